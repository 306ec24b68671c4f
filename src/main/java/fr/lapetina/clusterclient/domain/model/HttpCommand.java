package fr.lapetina.clusterclient.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * An HTTP exchange against one of the cluster's REST services.
 */
public record HttpCommand(
        String method,
        String path,
        String contentType,
        byte[] body,
        Map<String, String> headers
) implements ServicePayload {

    public HttpCommand {
        method = method != null ? method : "GET";
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public static HttpCommand get(String path) {
        return new HttpCommand("GET", path, null, null, null);
    }

    public static HttpCommand post(String path, String contentType, byte[] body) {
        return new HttpCommand("POST", path, contentType, body, null);
    }

    public static HttpCommand postJson(String path, String json) {
        return post(path, "application/json", json.getBytes(StandardCharsets.UTF_8));
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    @Override
    public String describe() {
        return method + " " + path;
    }
}
