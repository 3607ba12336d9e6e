package org.learningjava.photosearch.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.photosearch.application.usecase.SearchPhotosUseCase;
import org.learningjava.photosearch.config.PhotoSearchProperties;
import org.learningjava.photosearch.domain.error.ImageReadException;
import org.learningjava.photosearch.domain.model.photo.SearchResult;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/search")
public class SearchController {

    private final SearchPhotosUseCase search;
    private final PhotoSearchProperties props;

    public SearchController(SearchPhotosUseCase search, PhotoSearchProperties props) {
        this.search = search;
        this.props = props;
    }

    @PostMapping("/text")
    public SearchResponse byText(@Valid @RequestBody TextSearchRequest req) {
        int k = req.k() != null ? req.k() : props.getSearch().getDefaultK();
        return SearchResponse.of(search.searchByText(req.text(), req.aspect(), k));
    }

    @PostMapping(value = "/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public SearchResponse byImage(@RequestParam("file") MultipartFile file,
                                  @RequestParam(value = "aspect", required = false) String aspect,
                                  @RequestParam(value = "k", required = false) Integer k) {
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new ImageReadException("Cannot read uploaded file " + file.getOriginalFilename(), e);
        }
        int limit = k != null ? k : props.getSearch().getDefaultK();
        return SearchResponse.of(search.searchByImage(bytes, aspect, limit));
    }

    // ---------- DTOs ----------
    public record TextSearchRequest(@NotBlank String text, String aspect, Integer k) {}

    public record SearchResponse(int count, List<SearchResult> results) {
        static SearchResponse of(List<SearchResult> results) {
            return new SearchResponse(results.size(), results);
        }
    }
}
