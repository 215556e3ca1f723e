package com.z254.sentinel.guardian.enhancement;

import java.util.Locale;

/**
 * Kind of enhancement proposed for a recurring issue.
 */
public enum EnhancementCategory {
    AUTO_REMEDIATION,
    SECURITY,
    PERFORMANCE,
    MONITORING,
    RELIABILITY;

    public String slug() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
