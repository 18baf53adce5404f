package io.catalogconnector.client.catalog;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * Local HTTP server standing in for a catalog connector. Answers each path with a canned
 * status and body and remembers the last request body and credential header it received.
 */
public class FakeConnector implements AutoCloseable {

    private final HttpServer server;
    private final Map<String, String> bodies = new ConcurrentHashMap<>();
    private final Map<String, String> credentials = new ConcurrentHashMap<>();

    public FakeConnector() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.start();
    }

    public FakeConnector respond(String path, String credentialsHeader, int status, String body) {
        server.createContext(path, exchange -> {
            bodies.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String locator = exchange.getRequestHeaders().getFirst(credentialsHeader);
            if (locator != null) {
                credentials.put(path, locator);
            }
            reply(exchange, status, body);
        });
        return this;
    }

    public FakeConnector getAssetInfo(int status, String body) {
        return respond(OpenApiDataCatalog.GET_ASSET_PATH, OpenApiDataCatalog.READ_CREDENTIALS_HEADER, status, body);
    }

    public FakeConnector createAsset(int status, String body) {
        return respond(OpenApiDataCatalog.CREATE_ASSET_PATH, OpenApiDataCatalog.WRITE_CREDENTIALS_HEADER, status, body);
    }

    public String url() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    public String lastBody(String path) {
        return bodies.get(path);
    }

    public String lastCredentials(String path) {
        return credentials.get(path);
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private static void reply(HttpExchange exchange, int status, String body) throws IOException {
        byte[] response = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, response.length == 0 ? -1 : response.length);
        if (response.length > 0) {
            exchange.getResponseBody().write(response);
        }
        exchange.close();
    }
}
