package com.signup.config;

import com.signup.core.Slf4jStepLogger;
import com.signup.identity.adapter.InMemoryDomainEventPublisher;
import com.signup.identity.adapter.InMemoryUserRepository;
import com.signup.identity.adapter.LoggingDomainEventListener;
import com.signup.identity.adapter.Pbkdf2CredentialHasher;
import com.signup.identity.adapter.UuidIdentifierGenerator;
import com.signup.identity.command.RegisterUserHandler;
import com.signup.identity.command.RegisterUserPipeline;
import com.signup.identity.domain.EventKind;
import com.signup.metrics.MetricsRecorder;
import com.signup.metrics.SimpleMetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires a ready-to-use registration handler from settings, backed by the in-memory adapters.
 * Unless an executor is supplied, hashing runs on a bounded pool owned by this instance and
 * released by {@link #close()}; it never shares the common pool with the pipeline's own work.
 */
public final class SignUpBootstrap implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SignUpBootstrap.class);

    private final RegistrationSettings settings;
    private final InMemoryUserRepository repository;
    private final InMemoryDomainEventPublisher publisher;
    private final Pbkdf2CredentialHasher hasher;
    private final MetricsRecorder recorder;
    private final RegisterUserHandler handler;
    private final ExecutorService ownedHashPool;

    private SignUpBootstrap(RegistrationSettings settings, Executor hashExecutor, ExecutorService ownedHashPool) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.repository = new InMemoryUserRepository();
        this.publisher = new InMemoryDomainEventPublisher()
            .subscribe(EventKind.USER_CREATED, new LoggingDomainEventListener());
        this.ownedHashPool = ownedHashPool;
        this.hasher = new Pbkdf2CredentialHasher(settings.hashIterations(), hashExecutor);
        this.recorder = new SimpleMetricsRecorder();
        RegisterUserPipeline pipeline = RegisterUserPipeline.builder()
            .name(settings.pipelineName())
            .identifierGenerator(new UuidIdentifierGenerator())
            .credentialHasher(hasher)
            .userRepository(repository)
            .eventPublisher(publisher)
            .emailFormat(settings.emailFormat())
            .credentialPolicy(settings.credentialPolicy())
            .logger(new Slf4jStepLogger(settings.loggerContext()))
            .recorder(recorder)
            .build();
        this.handler = new RegisterUserHandler(pipeline);
        log.info("registration pipeline '{}' ready: steps={}, hash iterations={}",
            pipeline.name(), pipeline.stepTags(), settings.hashIterations());
    }

    public static SignUpBootstrap fromSettings(RegistrationSettings settings) {
        ExecutorService pool = Executors.newFixedThreadPool(defaultHashThreads(), hashThreads());
        return new SignUpBootstrap(settings, pool, pool);
    }

    /** Hashing on a caller-managed executor; {@link #close()} leaves it running. */
    public static SignUpBootstrap fromSettings(RegistrationSettings settings, Executor hashExecutor) {
        return new SignUpBootstrap(settings, Objects.requireNonNull(hashExecutor, "hashExecutor"), null);
    }

    public static SignUpBootstrap fromClasspath() throws IOException {
        return fromSettings(RegistrationSettingsLoader.loadDefault());
    }

    public RegistrationSettings settings() { return settings; }
    public RegisterUserHandler handler() { return handler; }
    public InMemoryUserRepository repository() { return repository; }
    public InMemoryDomainEventPublisher publisher() { return publisher; }
    public Pbkdf2CredentialHasher hasher() { return hasher; }
    public MetricsRecorder recorder() { return recorder; }

    ExecutorService ownedHashPool() { return ownedHashPool; }

    @Override
    public void close() {
        if (ownedHashPool != null) ownedHashPool.shutdown();
    }

    private static int defaultHashThreads() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    }

    private static ThreadFactory hashThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "signup-hash-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
