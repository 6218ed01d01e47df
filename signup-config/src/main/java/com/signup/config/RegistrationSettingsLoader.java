package com.signup.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signup.identity.validation.CredentialPolicy;
import com.signup.identity.validation.EmailFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link RegistrationSettings} from JSON. Absent sections keep their defaults.
 * <pre>{@code
 * { "pipeline": "register_user", "loggerContext": "SignUp",
 *   "email": { "maxLength": 254 },
 *   "credential": { "minLength": 1, "maxLength": 256, "requireDigit": false,
 *                   "requireLetter": false, "requireSymbol": false },
 *   "hashing": { "iterations": 120000 } }
 * }</pre>
 */
public final class RegistrationSettingsLoader {
    public static final String DEFAULT_RESOURCE = "/signup.json";

    private static final Logger log = LoggerFactory.getLogger(RegistrationSettingsLoader.class);
    private static final ObjectMapper M = new ObjectMapper();
    private RegistrationSettingsLoader() {}

    public static RegistrationSettings load(InputStream in) throws IOException {
        JsonNode root = M.readTree(in);
        if (root == null || root.isMissingNode()) return RegistrationSettings.defaults();
        if (!root.isObject()) throw new IOException("Settings root must be an object");
        RegistrationSettings defaults = RegistrationSettings.defaults();

        String pipeline = text(root, "pipeline", defaults.pipelineName());
        String loggerContext = text(root, "loggerContext", defaults.loggerContext());

        JsonNode email = section(root, "email");
        JsonNode cred = section(root, "credential");
        JsonNode hashing = section(root, "hashing");
        CredentialPolicy d = defaults.credentialPolicy();
        int maxEmail = intOr(email, "maxLength", "email.maxLength", defaults.emailFormat().maxLength());
        int minLength = intOr(cred, "minLength", "credential.minLength", d.minLength());
        int maxLength = intOr(cred, "maxLength", "credential.maxLength", d.maxLength());
        boolean digit = boolOr(cred, "requireDigit", "credential.requireDigit", d.requireDigit());
        boolean letter = boolOr(cred, "requireLetter", "credential.requireLetter", d.requireLetter());
        boolean symbol = boolOr(cred, "requireSymbol", "credential.requireSymbol", d.requireSymbol());
        int iterations = intOr(hashing, "iterations", "hashing.iterations", defaults.hashIterations());

        try {
            return new RegistrationSettings(pipeline, loggerContext, new EmailFormat(maxEmail),
                new CredentialPolicy(minLength, maxLength, digit, letter, symbol), iterations);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid settings: " + e.getMessage(), e);
        }
    }

    public static RegistrationSettings load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /** Classpath {@value #DEFAULT_RESOURCE}, or built-in defaults when it is absent. */
    public static RegistrationSettings loadDefault() throws IOException {
        try (InputStream in = RegistrationSettingsLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.info("{} not on classpath, using built-in registration settings", DEFAULT_RESOURCE);
                return RegistrationSettings.defaults();
            }
            return load(in);
        }
    }

    private static JsonNode section(JsonNode root, String field) throws IOException {
        JsonNode n = root.path(field);
        if (!n.isMissingNode() && !n.isObject()) throw new IOException("Field '" + field + "' must be an object");
        return n;
    }

    private static String text(JsonNode n, String field, String fallback) throws IOException {
        if (!n.has(field)) return fallback;
        JsonNode v = n.get(field);
        if (!v.isTextual()) throw new IOException("Field '" + field + "' must be a string");
        return v.asText();
    }

    private static int intOr(JsonNode n, String name, String field, int fallback) throws IOException {
        if (!n.has(name)) return fallback;
        JsonNode v = n.get(name);
        if (!v.isInt()) throw new IOException("Field '" + field + "' must be an integer");
        return v.intValue();
    }

    private static boolean boolOr(JsonNode n, String name, String field, boolean fallback) throws IOException {
        if (!n.has(name)) return fallback;
        JsonNode v = n.get(name);
        if (!v.isBoolean()) throw new IOException("Field '" + field + "' must be a boolean");
        return v.booleanValue();
    }
}
