package racingline.compute.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import racingline.compute.service.OptimizationService;
import racingline.config.ApiRoutes;
import racingline.domain.dto.ModelDescriptor;
import racingline.domain.dto.OptimizationRequest;
import racingline.domain.dto.OptimizationResponse;
import racingline.domain.dto.VehicleResult;
import racingline.domain.exception.InvalidOptimizationRequestException;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = OptimizationController.class)
class OptimizationControllerTest {

    // Campos en snake_case: se aceptan gracias a los alias de Jackson
    private static final String SNAKE_CASE_BODY = """
            {
              "track_points": [{"x": 0, "y": 0}, {"x": 100, "y": 0}, {"x": 100, "y": 100}, {"x": 0, "y": 100}],
              "width": 12.0,
              "friction": 0.9,
              "model": "basic",
              "cars": [{
                "id": "car_1", "mass": 750, "length": 5, "width": 2,
                "max_steering_angle": 30, "max_acceleration": 10,
                "drag_coefficient": 1.1, "lift_coefficient": 3.5
              }]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OptimizationService optimizationService;

    @Test
    @DisplayName("POST /v1/optimize devuelve 200 con las líneas optimizadas")
    void optimize_ShouldReturn200_WhenRequestIsValid() throws Exception {
        // A. GIVEN
        VehicleResult line = VehicleResult.builder()
                .vehicleId("car_1")
                .modelId("basic")
                .coordinates(new double[][]{{0, 0}, {100, 0}, {0, 0}})
                .speeds(new double[]{20.0, 25.0, 20.0})
                .lapTime(12.5)
                .fallback(false)
                .build();
        given(optimizationService.optimize(any())).willReturn(new OptimizationResponse("basic", List.of(line), 42L));

        // B. WHEN & THEN
        mockMvc.perform(post(ApiRoutes.OPTIMIZE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SNAKE_CASE_BODY))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modelId").value("basic"))
                .andExpect(jsonPath("$.executionTimeMs").value(42))
                .andExpect(jsonPath("$.optimalLines[0].vehicleId").value("car_1"))
                .andExpect(jsonPath("$.optimalLines[0].coordinates[1][0]").value(100.0))
                .andExpect(jsonPath("$.optimalLines[0].lapTime").value(12.5));
    }

    @Test
    @DisplayName("Los alias snake_case se traducen a los campos de la petición")
    void optimize_ShouldBindSnakeCaseAliases() throws Exception {
        given(optimizationService.optimize(any())).willReturn(new OptimizationResponse("basic", List.of(), 1L));

        mockMvc.perform(post(ApiRoutes.OPTIMIZE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SNAKE_CASE_BODY))
                .andExpect(status().isOk());

        verify(optimizationService).optimize(argThat((OptimizationRequest request) ->
                request.trackPoints().size() == 4
                        && request.trackWidth() == 12.0
                        && "basic".equals(request.modelId())
                        && request.vehicles().get(0).maxSteeringAngle() == 30.0
                        && request.vehicles().get(0).dragCoefficient() == 1.1));
    }

    @Test
    @DisplayName("Una entrada inválida devuelve 400 con el mensaje del validador")
    void optimize_ShouldReturn400_WhenValidationFails() throws Exception {
        given(optimizationService.optimize(any()))
                .willThrow(new InvalidOptimizationRequestException("Se requieren al menos 3 puntos de pista (recibidos: 2)"));

        mockMvc.perform(post(ApiRoutes.OPTIMIZE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SNAKE_CASE_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Se requieren al menos 3 puntos de pista (recibidos: 2)"));
    }

    @Test
    @DisplayName("Un JSON mal formado devuelve 400")
    void optimize_ShouldReturn400_WhenBodyIsMalformed() throws Exception {
        mockMvc.perform(post(ApiRoutes.OPTIMIZE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"track_points\": [oops"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    @Test
    @DisplayName("Un fallo inesperado devuelve 500 sin filtrar detalles")
    void optimize_ShouldReturn500_WhenUnexpectedErrorOccurs() throws Exception {
        given(optimizationService.optimize(any())).willThrow(new IllegalStateException("pool caído"));

        mockMvc.perform(post(ApiRoutes.OPTIMIZE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SNAKE_CASE_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value(500));
    }

    @Test
    @DisplayName("GET /v1/models lista los modelos disponibles")
    void listModels_ShouldReturnDescriptors() throws Exception {
        given(optimizationService.listModels()).willReturn(List.of(
                new ModelDescriptor("physics_based", "Physics-Based Model", "desc", 0.4, List.of("a")),
                new ModelDescriptor("basic", "Basic Model", "desc", 0.3, List.of("b"))));

        mockMvc.perform(get(ApiRoutes.MODELS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value("physics_based"))
                .andExpect(jsonPath("$[1].trackUsageFraction").value(0.3));
    }
}
