package com.toolgate.gateway.domain.request;

import java.util.List;
import java.util.Optional;

/**
 * Directives encoded in the request path below the resource base path.
 *
 * <p>Recognised shapes, each optionally followed by a slash:
 *
 * <pre>
 * /
 * /readonly
 * /insiders
 * /readonly/insiders
 * /x/{toolset}
 * /x/{toolset}/readonly
 * /x/{toolset}/insiders
 * /x/{toolset}/readonly/insiders
 * </pre>
 *
 * @param toolset  the toolset named by {@code /x/{toolset}}, or null
 * @param readOnly whether the route ends in {@code readonly}
 * @param insiders whether the route ends in {@code insiders}
 */
public record RouteDirectives(String toolset, boolean readOnly, boolean insiders) {

    private static final RouteDirectives NONE = new RouteDirectives(null, false, false);

    public static RouteDirectives none() {
        return NONE;
    }

    /**
     * Parses a path relative to the resource base path.
     *
     * @return the directives, or empty when the path is not one of the recognised shapes
     */
    public static Optional<RouteDirectives> parse(String relativePath) {
        if (relativePath == null || relativePath.isEmpty() || relativePath.equals("/")) {
            return Optional.of(NONE);
        }
        if (!relativePath.startsWith("/")) {
            return Optional.empty();
        }
        String trimmed = relativePath.endsWith("/")
                ? relativePath.substring(1, relativePath.length() - 1)
                : relativePath.substring(1);
        List<String> segments = List.of(trimmed.split("/", -1));

        int i = 0;
        String toolset = null;
        if (segments.size() >= 2 && segments.get(0).equals("x")) {
            toolset = segments.get(1);
            if (toolset.isEmpty()) {
                return Optional.empty();
            }
            i = 2;
        }
        boolean readOnly = false;
        if (i < segments.size() && segments.get(i).equals("readonly")) {
            readOnly = true;
            i++;
        }
        boolean insiders = false;
        if (i < segments.size() && segments.get(i).equals("insiders")) {
            insiders = true;
            i++;
        }
        if (i != segments.size()) {
            return Optional.empty();
        }
        return Optional.of(new RouteDirectives(toolset, readOnly, insiders));
    }
}
