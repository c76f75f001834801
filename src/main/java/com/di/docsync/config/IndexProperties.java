package com.di.docsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Downstream search index. Bound from {@code docsync.index.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "docsync.index")
public class IndexProperties {

    /** {@code http} talks to the document API; {@code memory} keeps documents in process. */
    private String mode = "memory";

    private String endpoint = "http://localhost:8080";

    private String namespace = "docsync";

    private String documentType = "record";

    private int connectTimeoutMs = 5_000;

    private int readTimeoutMs = 30_000;
}
