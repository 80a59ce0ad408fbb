package com.codeflag.tools.cli;

import com.codeflag.common.crypto.FernetCipher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CodeflagCommandTest {

    static final String SIGNATURE_KEY  = "test-signature-key";
    static final String ENCRYPTION_KEY = "cw_0x689RpI-jtRR7oE8h_eQsKImvJapLeSbXpwF4e4=";

    final StringWriter out = new StringWriter();
    final StringWriter err = new StringWriter();
    final ObjectMapper json = new ObjectMapper();

    @TempDir Path tmp;

    HttpServer server;

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    // ------------------------------------------------------------------
    // keygen
    // ------------------------------------------------------------------

    @Test
    void keygen_printsUsableKeys() {
        assertThat(execute("keygen")).isZero();

        String[] lines = out.toString().strip().split("\\R");
        assertThat(lines).hasSize(2);
        assertThat(lines[0]).startsWith("ENCRYPTION_KEY=");
        assertThat(lines[1]).startsWith("SIGNATURE_KEY=");
        String key = lines[0].substring("ENCRYPTION_KEY=".length());
        FernetCipher cipher = new FernetCipher(key);
        assertThat(new String(cipher.decrypt(cipher.encrypt("{}")), StandardCharsets.UTF_8)).isEqualTo("{}");
    }

    // ------------------------------------------------------------------
    // flag
    // ------------------------------------------------------------------

    @Test
    void flag_text_printsHmac() {
        assertThat(execute("flag", "--signature-key", SIGNATURE_KEY, "hi\n")).isZero();

        assertThat(out.toString().strip())
                .isEqualTo("0656c03231c246945d55e356440a56ca9e956db8a6e25365ffecafadffaeb506");
    }

    @Test
    void flag_file_hashesExactContents() throws IOException {
        Path expected = Files.writeString(tmp.resolve("expected.txt"), "hi\n");

        assertThat(execute("flag", "--signature-key", SIGNATURE_KEY, "--file", expected.toString())).isZero();

        assertThat(out.toString().strip())
                .isEqualTo("0656c03231c246945d55e356440a56ca9e956db8a6e25365ffecafadffaeb506");
    }

    @Test
    void flag_noKey_exits1() {
        assertThat(execute("flag", "--signature-key=", "hi")).isEqualTo(1);

        assertThat(err.toString()).contains("SIGNATURE_KEY");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void flag_neitherTextNorFile_exits2() {
        assertThat(execute("flag", "--signature-key", SIGNATURE_KEY)).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // encrypt-settings
    // ------------------------------------------------------------------

    @Test
    void encryptSettings_options_tokenDecryptsToObject() throws Exception {
        assertThat(execute("encrypt-settings", "--encryption-key", ENCRYPTION_KEY,
                "--memory-limit", "512", "--run-timeout", "3000")).isZero();

        JsonNode settings = decrypt(out.toString().strip());
        assertThat(settings.get("memory_limit").asInt()).isEqualTo(512);
        assertThat(settings.get("run_timeout").asInt()).isEqualTo(3000);
        assertThat(settings.has("compile_timeout")).isFalse();
    }

    @Test
    void encryptSettings_json_keptVerbatim() throws Exception {
        assertThat(execute("encrypt-settings", "--encryption-key", ENCRYPTION_KEY,
                "--json", "{\"compile_timeout\": 1500, \"note\": \"x\"}")).isZero();

        JsonNode settings = decrypt(out.toString().strip());
        assertThat(settings.get("compile_timeout").asInt()).isEqualTo(1500);
        assertThat(settings.get("note").asText()).isEqualTo("x");
    }

    @Test
    void encryptSettings_jsonArray_rejected() {
        assertThat(execute("encrypt-settings", "--encryption-key", ENCRYPTION_KEY, "--json", "[1,2]"))
                .isEqualTo(1);

        assertThat(err.toString()).contains("JSON object");
    }

    @Test
    void encryptSettings_invalidJson_rejected() {
        assertThat(execute("encrypt-settings", "--encryption-key", ENCRYPTION_KEY, "--json", "{nope"))
                .isEqualTo(1);

        assertThat(err.toString()).contains("not valid JSON");
    }

    @Test
    void encryptSettings_badKey_exits1() {
        assertThat(execute("encrypt-settings", "--encryption-key", "short", "--memory-limit", "1"))
                .isEqualTo(1);

        assertThat(err.toString()).contains("Fernet");
    }

    // ------------------------------------------------------------------
    // submit
    // ------------------------------------------------------------------

    @Test
    void submit_substitutesInputAndPrintsFlag() throws Exception {
        AtomicReference<String> received = new AtomicReference<>();
        String url = startScheduler(200, "{\"flag\":\"abc123\"}", received);
        Path code = Files.writeString(tmp.resolve("solution.py"), "print({{INPUT}})\n");
        Path input = Files.writeString(tmp.resolve("input.txt"), "42");

        assertThat(execute("submit", "python", code.toString(), input.toString(),
                "--settings", "gAAAAAtoken", "--url", url)).isZero();

        assertThat(out.toString().strip()).isEqualTo("abc123");
        JsonNode sent = json.readTree(received.get());
        assertThat(sent.get("code").asText()).isEqualTo("print(42)\n");
        assertThat(sent.get("language").asText()).isEqualTo("python");
        assertThat(sent.get("settings").asText()).isEqualTo("gAAAAAtoken");
    }

    @Test
    void submit_withoutInputOrSettings_sendsCodeAsIs() throws Exception {
        AtomicReference<String> received = new AtomicReference<>();
        String url = startScheduler(200, "{\"flag\":\"f\"}", received);
        Path code = Files.writeString(tmp.resolve("main.go"), "package main // {{INPUT}}");

        assertThat(execute("submit", "go", code.toString(), "--url", url)).isZero();

        JsonNode sent = json.readTree(received.get());
        assertThat(sent.get("code").asText()).isEqualTo("package main // {{INPUT}}");
        assertThat(sent.has("settings")).isFalse();
    }

    @Test
    void submit_errorStatus_printsDetailAndExits1() throws Exception {
        String url = startScheduler(504, "{\"detail\":\"Code execution timed out after 60 seconds.\"}",
                new AtomicReference<>());
        Path code = Files.writeString(tmp.resolve("loop.py"), "while True: pass");

        assertThat(execute("submit", "python", code.toString(), "--url", url)).isEqualTo(1);

        assertThat(err.toString()).contains("504").contains("timed out after 60 seconds");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void submit_missingCodeFile_exits1() {
        assertThat(execute("submit", "python", tmp.resolve("absent.py").toString(),
                "--url", "http://127.0.0.1:1/submit")).isEqualTo(1);

        assertThat(err.toString()).contains("cannot read");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new CodeflagCommand());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private JsonNode decrypt(String token) throws IOException {
        return json.readTree(new FernetCipher(ENCRYPTION_KEY).decrypt(token));
    }

    private String startScheduler(int status, String body, AtomicReference<String> received) throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/submit", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/submit";
    }
}
