package racingline.compute.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import racingline.compute.service.TrackCatalogService;
import racingline.config.ApiRoutes;
import racingline.domain.dto.OptimizationResponse;
import racingline.domain.dto.TrackPoint;
import racingline.domain.dto.TrackPresetDTO;
import racingline.domain.dto.TrackSummaryDTO;
import racingline.domain.exception.ResourceNotFoundException;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = TrackCatalogController.class)
class TrackCatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TrackCatalogService trackCatalogService;

    @Test
    @DisplayName("GET /v1/tracks devuelve los resúmenes del catálogo")
    void listTracks_ShouldReturnSummaries() throws Exception {
        given(trackCatalogService.listTracks()).willReturn(List.of(
                new TrackSummaryDTO("albert-park", "Albert Park Circuit", "Australia", 14.0, 0.82, 17)));

        mockMvc.perform(get(ApiRoutes.TRACKS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("albert-park"))
                .andExpect(jsonPath("$[0].pointCount").value(17));
    }

    @Test
    @DisplayName("GET /v1/tracks/{id} devuelve la pista completa")
    void getTrack_ShouldReturnPreset() throws Exception {
        TrackPresetDTO preset = TrackPresetDTO.builder()
                .id("oval")
                .name("Oval")
                .country("N/A")
                .width(20.0)
                .friction(1.0)
                .trackPoints(List.of(new TrackPoint(0, 0), new TrackPoint(10, 0), new TrackPoint(10, 10)))
                .build();
        given(trackCatalogService.getTrack("oval")).willReturn(preset);

        mockMvc.perform(get(ApiRoutes.TRACKS + "/{trackId}", "oval"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.width").value(20.0))
                .andExpect(jsonPath("$.trackPoints[1].x").value(10.0));
    }

    @Test
    @DisplayName("Una pista desconocida devuelve 404")
    void getTrack_ShouldReturn404_WhenTrackIsUnknown() throws Exception {
        given(trackCatalogService.getTrack("nowhere")).willThrow(new ResourceNotFoundException("Pista no encontrada: nowhere"));

        mockMvc.perform(get(ApiRoutes.TRACKS + "/{trackId}", "nowhere"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.message").value("Pista no encontrada: nowhere"));
    }

    @Test
    @DisplayName("POST /v1/tracks/{id}/optimize delega en el servicio con vehículos y modelo")
    void optimizeTrack_ShouldReturn200() throws Exception {
        given(trackCatalogService.optimizeTrack(eq("sample-circle"), any()))
                .willReturn(new OptimizationResponse("kapania", List.of(), 7L));

        mockMvc.perform(post(ApiRoutes.TRACKS + "/{trackId}/optimize", "sample-circle")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"model\": \"kapania\", \"cars\": []}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modelId").value("kapania"));
    }
}
