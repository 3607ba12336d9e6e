package org.learningjava.photosearch.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.photosearch.application.usecase.ManagePhotosUseCase;
import org.learningjava.photosearch.domain.model.photo.DeleteOutcome;
import org.learningjava.photosearch.domain.model.photo.IndexOutcome;
import org.learningjava.photosearch.domain.model.photo.PhotoRecord;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/photos")
public class PhotoController {

    private final ManagePhotosUseCase photos;

    public PhotoController(ManagePhotosUseCase photos) {
        this.photos = photos;
    }

    @GetMapping
    public Map<String, Object> list() {
        Set<String> paths = photos.listPhotoPaths();
        return Map.of("count", paths.size(), "paths", paths);
    }

    @GetMapping("/aspects")
    public List<AspectDto> aspects(@RequestParam String path) {
        return photos.aspectsOf(path).stream().map(AspectDto::from).toList();
    }

    /** Adds or replaces one aspect of one photo. A failed outcome is returned as the body, not thrown. */
    @PostMapping("/index")
    public ResponseEntity<IndexOutcome> index(@Valid @RequestBody IndexPhotoRequest req) {
        IndexOutcome outcome = photos.indexPhoto(ManagePhotosUseCase.parsePath(req.path()), req.aspect(), req.prompt());
        HttpStatus status;
        if (outcome.success()) status = HttpStatus.OK;
        else if (outcome.kind() == IndexOutcome.Kind.STORE_ERROR) status = HttpStatus.SERVICE_UNAVAILABLE;
        else status = HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(outcome);
    }

    @DeleteMapping
    public DeleteResponse delete(@RequestParam String path,
                                 @RequestParam(required = false) String aspect) {
        return DeleteResponse.from(photos.deletePhoto(path, aspect));
    }

    @DeleteMapping("/all")
    public Map<String, Object> clear() {
        photos.clear();
        return Map.of("cleared", true);
    }

    // ---------- DTOs ----------
    public record IndexPhotoRequest(@NotBlank String path, String aspect, String prompt) {}

    public record AspectDto(String photoPath, String aspectName, String description, int dimension) {
        static AspectDto from(PhotoRecord r) {
            return new AspectDto(r.photoPath(), r.aspectName(), r.description(), r.dimension());
        }
    }

    public record DeleteResponse(String photoPath, String aspectName, int deleted, boolean found, String message) {
        static DeleteResponse from(DeleteOutcome o) {
            return new DeleteResponse(o.photoPath(), o.aspectName(), o.deleted(), o.found(), o.message());
        }
    }
}
