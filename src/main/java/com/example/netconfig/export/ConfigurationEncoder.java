package com.example.netconfig.export;

import com.example.netconfig.domain.NetworkConfiguration;

/**
 * Renders a configuration as a response body. Implementations are pure:
 * the same configuration always yields the same text (TSV's timestamp comes
 * from the injected clock).
 */
public interface ConfigurationEncoder {

    ExportFormat format();

    String encode(NetworkConfiguration config);
}
