package com.koni.vitals.infrastructure.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Reads the Isolation Forest artifact. A missing or broken artifact is not fatal:
 * it is reported once and the pipeline runs on rules alone.
 */
@Slf4j
@RequiredArgsConstructor
public class IsolationForestModelLoader {

    private final ObjectMapper objectMapper;

    /**
     * @param resource location of the JSON artifact
     * @return the validated model, or empty when it cannot be used
     */
    public Optional<IsolationForestModel> load(Resource resource) {
        if (resource == null || !resource.exists()) {
            log.warn("Isolation Forest artifact not found, statistical classification disabled: location={}",
                resource == null ? null : resource.getDescription());
            return Optional.empty();
        }

        try (InputStream in = resource.getInputStream()) {
            IsolationForestModel model = objectMapper.readValue(in, IsolationForestModel.class);
            model.validate();
            log.info("Isolation Forest loaded: location={}, trees={}, maxSamples={}, offset={}",
                resource.getDescription(), model.getTrees().size(), model.getMaxSamples(), model.getOffset());
            return Optional.of(model);
        } catch (IOException | IllegalStateException e) {
            log.warn("Isolation Forest artifact unusable, statistical classification disabled: location={}, error={}",
                resource.getDescription(), e.getMessage());
            return Optional.empty();
        }
    }
}
