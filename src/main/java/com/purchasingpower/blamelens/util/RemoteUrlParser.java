package com.purchasingpower.blamelens.util;

import com.purchasingpower.blamelens.model.vcs.RemoteIdentity;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses git remote URLs into {@link RemoteIdentity}.
 *
 * <p>Handles these remote URL patterns:
 * <ul>
 *   <li>SCP-like SSH: {@code git@gitlab.com:group/subgroup/project.git}</li>
 *   <li>SSH URL: {@code ssh://git@gitlab.example.com:2222/group/project.git}</li>
 *   <li>HTTP(S): {@code https://github.com/owner/repo.git}, optionally with user info and port</li>
 * </ul>
 *
 * <p>SSH remotes map to {@code https://host}; HTTP(S) remotes keep their scheme and port.
 */
public final class RemoteUrlParser {

    // user@host:path, where host has no slash or colon and path does not start with '/'
    private static final Pattern SCP_LIKE = Pattern.compile("^[^@/\\s]+@([^:/\\s]+):(?!/)(.+)$");

    private RemoteUrlParser() {
    }

    public static Optional<RemoteIdentity> parse(String remoteUrl) {
        if (remoteUrl == null || remoteUrl.isBlank()) {
            return Optional.empty();
        }
        String url = remoteUrl.trim();

        Matcher scp = SCP_LIKE.matcher(url);
        if (scp.matches()) {
            return toIdentity("https://" + scp.group(1), scp.group(2));
        }

        URI uri = toUri(url);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            return Optional.empty();
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return switch (scheme) {
            case "ssh", "git+ssh" -> toIdentity("https://" + uri.getHost(), uri.getPath());
            case "http", "https" -> {
                String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
                yield toIdentity(scheme + "://" + uri.getHost() + port, uri.getPath());
            }
            default -> Optional.empty();
        };
    }

    /**
     * Hostname of a remote URL, without user info or port.
     */
    public static Optional<String> extractHostname(String remoteUrl) {
        if (remoteUrl == null || remoteUrl.isBlank()) {
            return Optional.empty();
        }
        String url = remoteUrl.trim();

        Matcher scp = SCP_LIKE.matcher(url);
        if (scp.matches()) {
            return Optional.of(scp.group(1));
        }

        URI uri = toUri(url);
        return uri == null ? Optional.empty() : Optional.ofNullable(uri.getHost());
    }

    /**
     * Hostname of a configured base URL with a leading {@code api.} removed, so that
     * {@code https://api.github.example.com} matches remotes on {@code github.example.com}.
     */
    public static Optional<String> configuredGitHost(String baseUrl) {
        URI uri = baseUrl == null ? null : toUri(baseUrl.trim());
        if (uri == null || uri.getHost() == null) {
            return Optional.empty();
        }
        return Optional.of(uri.getHost().replaceFirst("^api\\.", ""));
    }

    private static Optional<RemoteIdentity> toIdentity(String hostUrl, String rawPath) {
        if (rawPath == null) {
            return Optional.empty();
        }
        String path = rawPath.replaceAll("^/+", "").replaceAll("/+$", "");
        if (path.endsWith(".git")) {
            path = path.substring(0, path.length() - 4);
        }
        path = path.replaceAll("/+$", "");
        if (path.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RemoteIdentity(hostUrl, path));
    }

    private static URI toUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
