package com.mimecast.xoauth2.store;

import org.apache.commons.lang3.StringUtils;

/**
 * Secret store entry name template.
 *
 * <p>Expands <code>{host}</code>, <code>{user}</code> and <code>{port}</code> placeholders.
 */
public class EntryTemplate {

    private final String template;

    /**
     * Constructs a new EntryTemplate instance.
     *
     * @param template Template string.
     */
    public EntryTemplate(String template) {
        this.template = template;
    }

    /**
     * Checks if the template uses the port.
     *
     * @return Boolean.
     */
    public boolean usesPort() {
        return template.contains("{port}");
    }

    /**
     * Expands the template.
     *
     * @param host Host name.
     * @param user User name, may be null.
     * @param port Port, may be null.
     * @return Entry name.
     */
    public String expand(String host, String user, String port) {
        String name = template
                .replace("{host}", StringUtils.defaultString(host))
                .replace("{user}", StringUtils.defaultString(user))
                .replace("{port}", StringUtils.defaultString(port));

        // Collapse separators left behind by empty placeholders.
        name = name.replaceAll("/{2,}", "/");
        return StringUtils.strip(name, "/");
    }

    @Override
    public String toString() {
        return template;
    }
}
