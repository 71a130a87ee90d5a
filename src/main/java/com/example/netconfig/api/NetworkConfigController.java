package com.example.netconfig.api;

import com.example.netconfig.domain.NetworkConfiguration;
import com.example.netconfig.export.ConfigurationExporter;
import com.example.netconfig.export.ExportFormat;
import com.example.netconfig.service.NetworkConfigurationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Read and replace endpoints for the live network configuration.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class NetworkConfigController {

    private final NetworkConfigurationService configurationService;
    private final ConfigurationExporter exporter;

    /**
     * Current configuration in the requested encoding ({@code json} unless
     * {@code csv}, {@code tsv} or {@code simple} is asked for).
     */
    @GetMapping({"/", "/config"})
    public ResponseEntity<String> getConfiguration(@RequestParam(defaultValue = "json") String format) {
        ExportFormat exportFormat = ExportFormat.fromParam(format);
        try {
            NetworkConfiguration current = configurationService.current();
            String body = exporter.export(current, exportFormat);
            return ResponseEntity.ok()
                    .contentType(withUtf8(exportFormat.mediaType()))
                    .body(body);
        } catch (RuntimeException e) {
            log.error("Configuration read failed (format={})", exportFormat, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(withUtf8(MediaType.TEXT_PLAIN))
                    .body("ERROR: " + e.getMessage());
        }
    }

    @PostMapping("/config")
    public ResponseEntity<Map<String, String>> updateConfiguration(@Valid @RequestBody NetworkConfiguration config) {
        configurationService.replace(config);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Configuration updated successfully"
        ));
    }

    private static MediaType withUtf8(MediaType type) {
        return new MediaType(type, StandardCharsets.UTF_8);
    }
}
