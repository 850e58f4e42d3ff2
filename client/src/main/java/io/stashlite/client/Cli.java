// file: client/src/main/java/io/stashlite/client/Cli.java
package io.stashlite.client;

import java.io.PrintStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

/**
 * Simple CLI for a running StashLite daemon.
 *
 * Usage:
 *   stash-cli [--base-url http://host:port] get <key>
 *   stash-cli [--base-url http://host:port] put <key> <json> [--ttl <ms>] [--type <tag>]
 *   stash-cli [--base-url http://host:port] del <key>
 *   stash-cli [--base-url http://host:port] usage
 *   stash-cli [--base-url http://host:port] flush
 *
 * Examples:
 *   stash-cli put city:42 '{"aqi":35}' --ttl 60000 --type aqi
 *   stash-cli get city:42
 *   stash-cli flush
 *
 * Response bodies are printed as returned by the daemon.
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://127.0.0.1:8787";

    private static final String USAGE = """
            Usage:
              stash-cli [--base-url http://host:port] get <key>
              stash-cli [--base-url http://host:port] put <key> <json> [--ttl <ms>] [--type <tag>]
              stash-cli [--base-url http://host:port] del <key>
              stash-cli [--base-url http://host:port] usage
              stash-cli [--base-url http://host:port] flush
            """;

    private final HttpClient http;
    private final String baseUrl;
    private final PrintStream out;

    Cli(String baseUrl, PrintStream out) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** @return process exit code: 0 ok, 1 request failed or daemon unreachable, 2 bad usage */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                throw new CliException("missing command");
            }

            Cli cli = new Cli(parsed.getKey(), out);
            String cmd = rest[0];
            switch (cmd) {
                case "get" -> {
                    requireArgs(rest, 2, "get requires <key>");
                    cli.get(rest[1]);
                }
                case "put" -> {
                    if (rest.length < 3) throw new CliException("put requires <key> <json>");
                    cli.put(rest[1], rest[2], Arrays.copyOfRange(rest, 3, rest.length));
                }
                case "del" -> {
                    requireArgs(rest, 2, "del requires <key>");
                    cli.del(rest[1]);
                }
                case "usage" -> {
                    requireArgs(rest, 1, "usage takes no arguments");
                    cli.usage();
                }
                case "flush" -> {
                    requireArgs(rest, 1, "flush takes no arguments");
                    cli.flush();
                }
                default -> throw new CliException("unknown command: " + cmd);
            }
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            if (e.usageError) {
                err.println(USAGE);
                return 2;
            }
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 1;
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private static void requireArgs(String[] rest, int count, String message) {
        if (rest.length != count) throw new CliException(message);
    }

    private void get(String key) throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(cacheUri(key)).GET());
        if (resp.statusCode() == 404) {
            out.println("(not found)");
            return;
        }
        expect200("GET", resp);
        out.println(resp.body());
    }

    private void put(String key, String json, String[] flags) throws Exception {
        HttpRequest.Builder req = HttpRequest.newBuilder(cacheUri(key))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(json));

        for (int i = 0; i < flags.length; i++) {
            switch (flags[i]) {
                case "--ttl" -> req.header("X-Stash-Ttl-Ms", flagValue(flags, i++));
                case "--type" -> req.header("X-Stash-Type", flagValue(flags, i++));
                default -> throw new CliException("unknown put option: " + flags[i]);
            }
        }

        HttpResponse<String> resp = send(req);
        expect200("PUT", resp);
        out.println(resp.body());
    }

    private void del(String key) throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(cacheUri(key)).DELETE());
        expect200("DEL", resp);
        out.println("OK");
    }

    private void usage() throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(URI.create(baseUrl + "/admin/usage")).GET());
        expect200("USAGE", resp);
        out.println(resp.body());
    }

    private void flush() throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(URI.create(baseUrl + "/queue/flush"))
                .POST(HttpRequest.BodyPublishers.noBody()));
        expect200("FLUSH", resp);
        out.println(resp.body());
    }

    private HttpResponse<String> send(HttpRequest.Builder req) throws Exception {
        return http.send(req.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI cacheUri(String key) {
        String encoded = URLEncoder.encode(key, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(baseUrl + "/cache/" + encoded);
    }

    private static String flagValue(String[] flags, int i) {
        if (i + 1 >= flags.length) throw new CliException(flags[i] + " requires a value");
        return flags[i + 1];
    }

    private static void expect200(String what, HttpResponse<String> resp) {
        if (resp.statusCode() != 200) {
            throw new CliException(what + " failed (" + resp.statusCode() + "): " + resp.body(), false);
        }
    }

    private static final class CliException extends RuntimeException {
        final boolean usageError;

        CliException(String msg) {
            this(msg, true);
        }

        CliException(String msg, boolean usageError) {
            super(msg);
            this.usageError = usageError;
        }
    }
}
