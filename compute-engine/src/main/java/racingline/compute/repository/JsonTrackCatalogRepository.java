package racingline.compute.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Repository;
import racingline.domain.dto.TrackPresetDTO;
import racingline.factory.SampleTrackFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catálogo cargado una vez de {@code presets/tracks.json} al arrancar, más la pista circular de
 * ejemplo generada por {@link SampleTrackFactory}.
 */
@Slf4j
@Repository
public class JsonTrackCatalogRepository implements TrackCatalogRepository {

    static final String PRESETS_RESOURCE = "presets/tracks.json";
    public static final String SAMPLE_CIRCLE_ID = "sample-circle";

    private final Map<String, TrackPresetDTO> tracks;

    @Autowired
    public JsonTrackCatalogRepository(ObjectMapper objectMapper) {
        this(objectMapper, PRESETS_RESOURCE);
    }

    JsonTrackCatalogRepository(ObjectMapper objectMapper, String resource) {
        Map<String, TrackPresetDTO> loaded = new LinkedHashMap<>();
        for (TrackPresetDTO track : readPresets(objectMapper, resource)) {
            loaded.put(track.id(), track);
        }
        loaded.put(SAMPLE_CIRCLE_ID, sampleCircle());
        this.tracks = Collections.unmodifiableMap(loaded);
        log.info("Catálogo de pistas cargado: {}", tracks.keySet());
    }

    @Override
    public List<TrackPresetDTO> findAll() {
        return List.copyOf(tracks.values());
    }

    @Override
    public Optional<TrackPresetDTO> findById(String trackId) {
        return Optional.ofNullable(tracks.get(trackId));
    }

    private static List<TrackPresetDTO> readPresets(ObjectMapper objectMapper, String resource) {
        ClassPathResource file = new ClassPathResource(resource);
        if (!file.exists()) {
            log.warn("No se encontró {}. El catálogo solo contendrá la pista de ejemplo.", resource);
            return List.of();
        }
        try (InputStream in = file.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<TrackPresetDTO>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo leer el catálogo de pistas " + resource, e);
        }
    }

    private static TrackPresetDTO sampleCircle() {
        return TrackPresetDTO.builder()
                .id(SAMPLE_CIRCLE_ID)
                .name("Sample Circle")
                .country("N/A")
                .description("Circunferencia de 100 m de radio generada para pruebas")
                .width(15.0)
                .friction(1.0)
                .trackPoints(SampleTrackFactory.circle(100.0, 100))
                .build();
    }
}
