package cloud.signet.combiner.server;

import cloud.signet.combiner.CombinerConfig;
import cloud.signet.combiner.crypto.TestDealer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CombinerServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ACCOUNT = "0x" + "9c".repeat(20);
    private static final int KEY_VERSION = 2;

    private enum Mode { VALID, FORGED, QUOTA, SLOW }

    private final TestDealer dealer = new TestDealer(2, KEY_VERSION);
    private final List<HttpServer> signers = new ArrayList<>();
    private final List<String> forwardedKeyVersions = new CopyOnWriteArrayList<>();
    private final CountDownLatch releaseSlow = new CountDownLatch(1);
    private final ExecutorService signerExecutor = Executors.newCachedThreadPool();
    private final HttpClient client = HttpClient.newHttpClient();

    private CombinerServer server;
    private URI baseUri;

    @BeforeEach
    void setUp() {
        forwardedKeyVersions.clear();
    }

    @AfterEach
    void tearDown() {
        releaseSlow.countDown();
        if (server != null) {
            server.close();
        }
        for (HttpServer signer : signers) {
            signer.stop(0);
        }
        signerExecutor.shutdownNow();
    }

    @Test
    void returnsCombinedSignatureWithoutWaitingForSlowSigner() throws Exception {
        startCombiner(Mode.VALID, Mode.SLOW, Mode.VALID);
        String blinded = TestDealer.blindedMessageBase64();

        HttpResponse<String> response = post("/getBlindedMessageSig", blindedBody(blinded), "2");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertTrue(body.path("success").asBoolean());
        assertEquals(dealer.expectedSignatureBase64(blinded), body.path("combinedSignature").asText());
        assertEquals("3.1.0", body.path("version").asText());
        assertTrue(forwardedKeyVersions.stream().allMatch("2"::equals));
        assertFalse(forwardedKeyVersions.isEmpty());
    }

    @Test
    void toleratesForgedShareWhenEnoughHonestSignersRemain() throws Exception {
        startCombiner(Mode.FORGED, Mode.VALID, Mode.VALID);
        String blinded = TestDealer.blindedMessageBase64();

        HttpResponse<String> response = post("/getBlindedMessageSig", blindedBody(blinded), null);

        assertEquals(200, response.statusCode());
        assertEquals(dealer.expectedSignatureBase64(blinded),
            MAPPER.readTree(response.body()).path("combinedSignature").asText());
    }

    @Test
    void majorityQuotaErrorsSurfaceAsQuotaExceeded() throws Exception {
        startCombiner(Mode.QUOTA, Mode.QUOTA, Mode.VALID);

        HttpResponse<String> response = post("/getBlindedMessageSig", blindedBody(TestDealer.blindedMessageBase64()), "2");

        assertEquals(403, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertFalse(body.path("success").asBoolean());
        assertEquals("EXCEEDED_QUOTA", body.path("error").asText());
        assertEquals("3.1.0", body.path("version").asText());
    }

    @Test
    void rejectsMismatchedKeyVersionHeader() throws Exception {
        startCombiner(Mode.VALID, Mode.VALID, Mode.VALID);

        HttpResponse<String> response = post("/getBlindedMessageSig", blindedBody(TestDealer.blindedMessageBase64()), "7");

        assertEquals(400, response.statusCode());
        assertEquals("INVALID_KEY_HEADER", MAPPER.readTree(response.body()).path("error").asText());
        assertTrue(forwardedKeyVersions.isEmpty());
    }

    @Test
    void rejectsMalformedBodies() throws Exception {
        startCombiner(Mode.VALID, Mode.VALID, Mode.VALID);

        HttpResponse<String> notJson = post("/getBlindedMessageSig", "account=1", null);
        assertEquals(400, notJson.statusCode());
        assertEquals("INVALID_INPUT", MAPPER.readTree(notJson.body()).path("error").asText());

        HttpResponse<String> missingField = post("/getBlindedMessageSig",
            MAPPER.writeValueAsString(Map.of("account", ACCOUNT)), null);
        assertEquals(400, missingField.statusCode());
    }

    @Test
    void servesDomainRestrictedSignatures() throws Exception {
        startCombiner(Mode.VALID, Mode.QUOTA, Mode.VALID);
        String blinded = TestDealer.blindedMessageBase64();
        String request = MAPPER.writeValueAsString(Map.of(
            "domain", Map.of("name", "sequential-delay", "version", "1"),
            "blindedMessage", blinded));

        HttpResponse<String> response = post("/domain/sign", request, "2");

        assertEquals(200, response.statusCode());
        assertEquals(dealer.expectedSignatureBase64(blinded),
            MAPPER.readTree(response.body()).path("combinedSignature").asText());
    }

    @Test
    void rejectsNonPostRequests() throws Exception {
        startCombiner(Mode.VALID, Mode.VALID, Mode.VALID);

        HttpResponse<String> response = client.send(HttpRequest.newBuilder(baseUri.resolve("/getBlindedMessageSig"))
            .GET().build(), HttpResponse.BodyHandlers.ofString());

        assertEquals(405, response.statusCode());
        assertEquals("METHOD_NOT_ALLOWED", MAPPER.readTree(response.body()).path("error").asText());
    }

    @Test
    void reportsStatus() throws Exception {
        startCombiner(Mode.VALID, Mode.VALID, Mode.VALID);

        HttpResponse<String> response = client.send(HttpRequest.newBuilder(baseUri.resolve("/status")).GET().build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("3.1.0", body.path("version").asText());
        assertEquals(KEY_VERSION, body.path("keyVersion").asInt());
        assertEquals(2, body.path("threshold").asInt());
        assertEquals(3, body.path("signers").asInt());
        assertTrue(body.has("startedAt"));
    }

    private void startCombiner(Mode... modes) throws IOException {
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < modes.length; i++) {
            urls.add(startSigner(i + 1, modes[i]));
        }
        CombinerConfig config = CombinerConfig.builder()
            .signers(urls)
            .threshold(2)
            .keys(dealer.epoch())
            .signerTimeout(Duration.ofSeconds(10))
            .version("3.1.0")
            .port(0)
            .build();
        server = CombinerServer.create(config);
        server.start();
        baseUri = URI.create("http://localhost:" + server.port());
    }

    private String startSigner(int index, Mode mode) throws IOException {
        HttpServer signer = HttpServer.create(new InetSocketAddress(0), 0);
        signer.setExecutor(signerExecutor);
        signer.createContext("/getBlindedMessagePartialSig",
            exchange -> handleSigner(exchange, index, mode, "blindedQueryPhoneNumber"));
        signer.createContext("/domain/sign", exchange -> handleSigner(exchange, index, mode, "blindedMessage"));
        signer.start();
        signers.add(signer);
        return "http://localhost:" + signer.getAddress().getPort();
    }

    private void handleSigner(HttpExchange exchange, int index, Mode mode, String messageField) throws IOException {
        String keyVersion = exchange.getRequestHeaders().getFirst(CombinerConfig.KEY_VERSION_HEADER);
        if (keyVersion != null) {
            forwardedKeyVersions.add(keyVersion);
        }
        JsonNode request = MAPPER.readTree(exchange.getRequestBody().readAllBytes());
        String blinded = request.path(messageField).asText();
        exchange.getResponseHeaders().add(CombinerConfig.KEY_VERSION_HEADER, Integer.toString(KEY_VERSION));

        switch (mode) {
            case VALID:
                respond(exchange, 200, Map.of("success", true, "version", "1.0.0",
                    "signature", dealer.partialSignatureBase64(index, blinded)));
                break;
            case FORGED:
                respond(exchange, 200, Map.of("success", true, "version", "1.0.0",
                    "signature", dealer.forgedPartialSignatureBase64(index, blinded)));
                break;
            case QUOTA:
                respond(exchange, 403, Map.of("success", false, "error", "Exceeded quota"));
                break;
            case SLOW:
                try {
                    releaseSlow.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                respond(exchange, 200, Map.of("success", true,
                    "signature", dealer.partialSignatureBase64(index, blinded)));
                break;
            default:
                throw new IllegalStateException("unknown mode " + mode);
        }
    }

    private static void respond(HttpExchange exchange, int status, Object payload) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(payload);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private HttpResponse<String> post(String path, String body, String keyVersion) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(baseUri.resolve(path))
            .header("Content-Type", "application/json")
            .timeout(Duration.ofSeconds(10))
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (keyVersion != null) {
            builder.header(CombinerConfig.KEY_VERSION_HEADER, keyVersion);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private String blindedBody(String blinded) throws IOException {
        return MAPPER.writeValueAsString(Map.of("account", ACCOUNT, "blindedQueryPhoneNumber", blinded));
    }
}
