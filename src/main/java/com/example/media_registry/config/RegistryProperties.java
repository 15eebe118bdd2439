package com.example.media_registry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Registry configuration, bound from {@code registry.*}.
 */
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {
    /**
     * Header carrying the caller identity supplied by the host.
     */
    private String callerHeader = "X-Caller";

    private final Access access = new Access();

    public String getCallerHeader() {
        return callerHeader;
    }

    public void setCallerHeader(String callerHeader) {
        this.callerHeader = callerHeader;
    }

    public Access getAccess() {
        return access;
    }

    public static class Access {
        /**
         * Remove the access grants of a record when the record is deleted.
         */
        private boolean purgeOnDelete = true;

        public boolean isPurgeOnDelete() {
            return purgeOnDelete;
        }

        public void setPurgeOnDelete(boolean purgeOnDelete) {
            this.purgeOnDelete = purgeOnDelete;
        }
    }
}
