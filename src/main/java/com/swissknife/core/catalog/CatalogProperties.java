package com.swissknife.core.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "swissknife.catalog")
public class CatalogProperties {

    /** Advertise only the small read-mostly tool bundle. */
    private boolean minimalMode = false;

    public boolean isMinimalMode() { return minimalMode; }
    public void setMinimalMode(boolean minimalMode) { this.minimalMode = minimalMode; }
}
