package org.learningjava.photosearch.infrastructure.adapter.in.web;

import org.learningjava.photosearch.application.usecase.ManagePhotosUseCase;
import org.learningjava.photosearch.config.PhotoSearchProperties;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class ModelsController {

    private final ManagePhotosUseCase photos;
    private final PhotoSearchProperties props;

    public ModelsController(ManagePhotosUseCase photos, PhotoSearchProperties props) {
        this.photos = photos;
        this.props = props;
    }

    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public ModelsDto listModels() {
        return new ModelsDto(
                props.getOllama().getVisionModel(),
                props.getOllama().getEmbeddingModel(),
                photos.listAvailableModels()
        );
    }

    public record ModelsDto(String visionModel, String embeddingModel, List<String> available) {}
}
