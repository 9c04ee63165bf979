// file: client/src/main/java/io/compsync/client/Cli.java
package io.compsync.client;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Simple CLI for a running compsync server.
 *
 * Usage:
 *   compsync-cli [--base-url http://host:port] load <file.json>
 *   compsync-cli [--base-url http://host:port] overrides <docId> <nodeId>
 *   compsync-cli [--base-url http://host:port] all <docId>
 *
 * Examples:
 *   compsync-cli load library.json
 *   compsync-cli overrides screen 12:34
 *   compsync-cli all screen
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;

    Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String baseUrl = parsed.getKey();
            String[] rest = parsed.getValue();

            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(baseUrl);

            switch (cmd) {
                case "load" -> {
                    if (rest.length != 2) {
                        usageAndExit("load requires <file.json>");
                    }
                    cli.load(Path.of(rest[1]));
                }
                case "overrides" -> {
                    if (rest.length != 3) {
                        usageAndExit("overrides requires <docId> <nodeId>");
                    }
                    cli.overrides(rest[1], rest[2]);
                }
                case "all" -> {
                    if (rest.length != 2) {
                        usageAndExit("all requires <docId>");
                    }
                    cli.all(rest[1]);
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /** The document id is read from the file so the request path matches the body. */
    private void load(Path file) throws Exception {
        byte[] body = Files.readAllBytes(file);
        String id = documentId(new String(body, StandardCharsets.UTF_8));
        if (id == null) {
            throw new CliException("no top-level \"id\" in " + file);
        }

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/documents/" + segment(id)))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("load failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println(resp.body());
    }

    private void overrides(String docId, String nodeId) throws Exception {
        print(getOrFail("/documents/" + segment(docId) + "/instances/" + segment(nodeId) + "/overrides"));
    }

    private void all(String docId) throws Exception {
        print(getOrFail("/documents/" + segment(docId) + "/overrides"));
    }

    private String getOrFail(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 404) {
            throw new CliException("not found: " + resp.body());
        }
        if (resp.statusCode() != 200) {
            throw new CliException("GET failed (" + resp.statusCode() + "): " + resp.body());
        }
        return resp.body();
    }

    private static void print(String body) {
        System.out.println(body);
    }

    /**
     * Small ad-hoc lookup of the first "id" member; the CLI stays free of JSON deps.
     * Documents put "id" before "root", so the first match is the document's own id.
     */
    static String documentId(String json) {
        String marker = "\"id\"";
        int idx = json.indexOf(marker);
        if (idx < 0) return null;
        int colon = json.indexOf(':', idx + marker.length());
        int firstQuote = json.indexOf('"', colon + 1);
        int secondQuote = json.indexOf('"', firstQuote + 1);
        if (colon < 0 || firstQuote < 0 || secondQuote < 0) return null;
        return json.substring(firstQuote + 1, secondQuote);
    }

    private static String segment(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  compsync-cli [--base-url http://host:port] load <file.json>
                  compsync-cli [--base-url http://host:port] overrides <docId> <nodeId>
                  compsync-cli [--base-url http://host:port] all <docId>
                """);
        System.exit(1);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
