package org.learningjava.photosearch.infrastructure.adapter.in.web;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.photosearch.application.usecase.ManagePhotosUseCase;
import org.learningjava.photosearch.config.PhotoSearchProperties;
import org.learningjava.photosearch.domain.model.photo.DeleteOutcome;
import org.learningjava.photosearch.domain.model.photo.IndexOutcome;
import org.learningjava.photosearch.domain.model.photo.PhotoRecord;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.List;
import java.util.TreeSet;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class PhotoControllerTest {

    private ManagePhotosUseCase photos;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        photos = mock(ManagePhotosUseCase.class);
        mvc = MockMvcBuilders.standaloneSetup(
                        new PhotoController(photos),
                        new ModelsController(photos, new PhotoSearchProperties()))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void list_returnsDistinctPaths() throws Exception {
        when(photos.listPhotoPaths()).thenReturn(new TreeSet<>(List.of("/p/b.jpg", "/p/a.jpg")));

        mvc.perform(get("/photos"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(2)))
                .andExpect(jsonPath("$.paths", contains("/p/a.jpg", "/p/b.jpg")));
    }

    @Test
    void aspects_listsRecordsOfOnePhoto() throws Exception {
        when(photos.aspectsOf("/p/a.jpg")).thenReturn(List.of(
                new PhotoRecord("/p/a.jpg", "color", "mostly red", new float[]{1f, 0f, 0f}),
                new PhotoRecord("/p/a.jpg", "default", "a red car", new float[]{0f, 1f, 0f})));

        mvc.perform(get("/photos/aspects").param("path", "/p/a.jpg"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].aspectName", is("color")))
                .andExpect(jsonPath("$[0].dimension", is(3)))
                .andExpect(jsonPath("$[1].description", is("a red car")));
    }

    @Test
    void index_successIsOk() throws Exception {
        when(photos.indexPhoto(Path.of("/p/a.jpg"), "mood", "How does it feel?"))
                .thenReturn(IndexOutcome.indexed("/p/a.jpg", "mood"));

        mvc.perform(post("/photos/index").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"/p/a.jpg\",\"aspect\":\"mood\",\"prompt\":\"How does it feel?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind", is("INDEXED")))
                .andExpect(jsonPath("$.message", is("Indexed /p/a.jpg [mood]")));
    }

    @Test
    void index_failedOutcomeIsUnprocessable() throws Exception {
        when(photos.indexPhoto(any(), any(), any()))
                .thenReturn(IndexOutcome.failed("/p/a.jpg", "default", IndexOutcome.Kind.PROVIDER_ERROR, "timeout"));

        mvc.perform(post("/photos/index").contentType(MediaType.APPLICATION_JSON).content("{\"path\":\"/p/a.jpg\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind", is("PROVIDER_ERROR")));
    }

    @Test
    void index_storeFailureIsServiceUnavailable() throws Exception {
        when(photos.indexPhoto(any(), any(), any()))
                .thenReturn(IndexOutcome.failed("/p/a.jpg", "default", IndexOutcome.Kind.STORE_ERROR, "down"));

        mvc.perform(post("/photos/index").contentType(MediaType.APPLICATION_JSON).content("{\"path\":\"/p/a.jpg\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.kind", is("STORE_ERROR")));
    }

    @Test
    void index_malformedPathIsBadRequest() throws Exception {
        mvc.perform(post("/photos/index").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"/p/a\\u0000.jpg\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("validation_failed")));
        verify(photos, never()).indexPhoto(any(), any(), any());
    }

    @Test
    void delete_oneAspect() throws Exception {
        when(photos.deletePhoto("/p/a.jpg", "color")).thenReturn(new DeleteOutcome("/p/a.jpg", "color", 1));

        mvc.perform(delete("/photos").param("path", "/p/a.jpg").param("aspect", "color"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted", is(1)))
                .andExpect(jsonPath("$.found", is(true)))
                .andExpect(jsonPath("$.message", is("Deleted 1 record(s) for /p/a.jpg [color]")));
    }

    @Test
    void delete_missingIsOkWithFoundFalse() throws Exception {
        when(photos.deletePhoto("/p/x.jpg", null)).thenReturn(new DeleteOutcome("/p/x.jpg", null, 0));

        mvc.perform(delete("/photos").param("path", "/p/x.jpg"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found", is(false)))
                .andExpect(jsonPath("$.message", is("No records found for /p/x.jpg (all aspects)")));
    }

    @Test
    void clear_wipesIndex() throws Exception {
        mvc.perform(delete("/photos/all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared", is(true)));
        verify(photos).clear();
    }

    @Test
    void models_listsConfiguredAndInstalled() throws Exception {
        when(photos.listAvailableModels()).thenReturn(List.of("llava-phi3:latest", "nomic-embed-text:latest"));

        mvc.perform(get("/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.visionModel", is("llava-phi3:latest")))
                .andExpect(jsonPath("$.embeddingModel", is("llava-phi3:latest")))
                .andExpect(jsonPath("$.available", hasSize(2)));
    }
}
