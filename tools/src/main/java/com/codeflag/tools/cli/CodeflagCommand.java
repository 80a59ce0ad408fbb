package com.codeflag.tools.cli;

import com.codeflag.common.crypto.FernetCipher;
import com.codeflag.common.crypto.FlagSigner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

@Command(
        name = "codeflag",
        mixinStandardHelpOptions = true,
        description = "Operator utilities for the code execution service",
        subcommands = {
                CodeflagCommand.KeygenCommand.class,
                CodeflagCommand.FlagCommand.class,
                CodeflagCommand.EncryptSettingsCommand.class,
                CodeflagCommand.SubmitCommand.class
        }
)
public final class CodeflagCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeflagCommand.class);

    static final ObjectMapper JSON = new ObjectMapper();

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: keygen | flag | encrypt-settings | submit");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Command(name = "keygen", description = "Generate a fresh ENCRYPTION_KEY and SIGNATURE_KEY")
    static final class KeygenCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            out.println("ENCRYPTION_KEY=" + FernetCipher.generateKey());
            out.println("SIGNATURE_KEY=" + FlagSigner.generateKey());
            return 0;
        }
    }

    @Command(name = "flag", description = "Print the flag expected for a given program output")
    static final class FlagCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Option(names = "--signature-key", defaultValue = "${env:SIGNATURE_KEY}",
                description = "HMAC key (default: $SIGNATURE_KEY)")
        String signatureKey;

        @Option(names = "--file", description = "Hash this file's exact contents instead of TEXT")
        Path file;

        @Parameters(arity = "0..1", paramLabel = "TEXT", description = "Expected stdout")
        String text;

        @Override
        public Integer call() {
            PrintWriter err = spec.commandLine().getErr();
            if (isBlank(signatureKey)) {
                err.println("Error: SIGNATURE_KEY environment variable not set.");
                return 1;
            }
            if ((file == null) == (text == null)) {
                err.println("Error: give either TEXT or --file, not both.");
                return 2;
            }
            String output;
            if (file != null) {
                try {
                    output = Files.readString(file, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    err.println("Error: cannot read " + file + ": " + e.getMessage());
                    return 1;
                }
            } else {
                output = text;
            }
            spec.commandLine().getOut().println(new FlagSigner(signatureKey).sign(output));
            return 0;
        }
    }

    @Command(name = "encrypt-settings", description = "Produce an encrypted settings token for submissions")
    static final class EncryptSettingsCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Option(names = "--encryption-key", defaultValue = "${env:ENCRYPTION_KEY}",
                description = "Fernet key (default: $ENCRYPTION_KEY)")
        String encryptionKey;

        @Option(names = "--memory-limit", paramLabel = "MB", description = "Memory limit in MB")
        Integer memoryLimit;

        @Option(names = "--compile-timeout", paramLabel = "MS", description = "Compile timeout in milliseconds")
        Integer compileTimeout;

        @Option(names = "--run-timeout", paramLabel = "MS", description = "Run timeout in milliseconds")
        Integer runTimeout;

        @Option(names = "--json", description = "Raw settings object, instead of the individual options")
        String json;

        @Override
        public Integer call() {
            PrintWriter err = spec.commandLine().getErr();
            if (isBlank(encryptionKey)) {
                err.println("Error: ENCRYPTION_KEY environment variable not set.");
                return 1;
            }
            boolean anyField = memoryLimit != null || compileTimeout != null || runTimeout != null;
            if (json != null && anyField) {
                err.println("Error: --json cannot be combined with individual settings options.");
                return 2;
            }
            if (json == null && !anyField) {
                err.println("Error: nothing to encrypt; pass --memory-limit, --compile-timeout, --run-timeout or --json.");
                return 2;
            }

            FernetCipher cipher;
            try {
                cipher = new FernetCipher(encryptionKey);
            } catch (IllegalArgumentException e) {
                err.println("Error: Failed to initialize Fernet cipher: " + e.getMessage());
                return 1;
            }

            String settings;
            try {
                settings = json != null ? normalize(json) : JSON.writeValueAsString(fields());
            } catch (JsonProcessingException e) {
                err.println("Error: Input string is not valid JSON.");
                return 1;
            } catch (IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }
            spec.commandLine().getOut().println(cipher.encrypt(settings));
            return 0;
        }

        private ObjectNode fields() {
            ObjectNode node = JSON.createObjectNode();
            if (memoryLimit != null) {
                node.put("memory_limit", memoryLimit);
            }
            if (compileTimeout != null) {
                node.put("compile_timeout", compileTimeout);
            }
            if (runTimeout != null) {
                node.put("run_timeout", runTimeout);
            }
            return node;
        }

        private static String normalize(String raw) throws JsonProcessingException {
            JsonNode node = JSON.readTree(raw);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Settings must be a JSON object.");
            }
            return JSON.writeValueAsString(node);
        }
    }

    @Command(name = "submit", description = "Submit a program to the scheduler and print its flag")
    static final class SubmitCommand implements Callable<Integer> {
        static final String INPUT_PLACEHOLDER = "{{INPUT}}";

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "LANGUAGE")
        String language;

        @Parameters(index = "1", paramLabel = "CODE_FILE")
        Path codeFile;

        @Parameters(index = "2", arity = "0..1", paramLabel = "INPUT_FILE",
                description = "Contents replace every " + INPUT_PLACEHOLDER + " in the code")
        Path inputFile;

        @Option(names = "--settings", description = "Encrypted settings token")
        String settings;

        @Option(names = "--url", defaultValue = "${env:SCHEDULER_URL:-http://localhost:8001/submit}",
                description = "Scheduler submit endpoint (default: ${DEFAULT-VALUE})")
        String url;

        @Option(names = "--timeout", defaultValue = "120", paramLabel = "SECONDS",
                description = "HTTP timeout (default: ${DEFAULT-VALUE})")
        long timeoutSeconds;

        @Override
        public Integer call() {
            PrintWriter err = spec.commandLine().getErr();
            String code;
            try {
                code = Files.readString(codeFile, StandardCharsets.UTF_8);
                if (inputFile != null) {
                    code = code.replace(INPUT_PLACEHOLDER, Files.readString(inputFile, StandardCharsets.UTF_8));
                }
            } catch (IOException e) {
                err.println("Error: cannot read input: " + e.getMessage());
                return 1;
            }

            ObjectNode payload = JSON.createObjectNode();
            payload.put("code", code);
            payload.put("language", language);
            if (!isBlank(settings)) {
                payload.put("settings", settings);
            }

            HttpResponse<String> response;
            try {
                response = post(JSON.writeValueAsString(payload));
            } catch (ConnectException e) {
                err.println("Error: Could not connect to scheduler at " + url + ". Is the scheduler running?");
                return 1;
            } catch (IOException e) {
                log.debug("Request to {} failed", url, e);
                err.println("Error: request to scheduler failed: " + e);
                return 1;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                err.println("Error: interrupted while waiting for the scheduler.");
                return 1;
            }

            JsonNode body;
            try {
                body = JSON.readTree(response.body());
            } catch (JsonProcessingException e) {
                err.println("Error: Failed to decode JSON response from scheduler. Raw response: " + response.body());
                return 1;
            }
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                String detail = body != null && body.hasNonNull("detail") ? body.get("detail").asText() : "Unknown error";
                err.println("Error: Scheduler returned an error status " + status + ": " + detail);
                return 1;
            }
            String flag = body != null && body.hasNonNull("flag") ? body.get("flag").asText() : String.valueOf(body);
            spec.commandLine().getOut().println(flag);
            return 0;
        }

        private HttpResponse<String> post(String json) throws IOException, InterruptedException {
            HttpClient http = HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)
                    .connectTimeout(Duration.ofSeconds(10))
                    .build();
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        }
    }
}
