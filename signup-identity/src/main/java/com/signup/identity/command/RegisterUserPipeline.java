package com.signup.identity.command;

import com.signup.core.AsyncStep;
import com.signup.core.Gather;
import com.signup.core.Outcome;
import com.signup.core.Pipe;
import com.signup.core.Slf4jStepLogger;
import com.signup.core.StepLogger;
import com.signup.core.Steps;
import com.signup.identity.domain.DomainEvent;
import com.signup.identity.domain.EmailAddress;
import com.signup.identity.domain.HashedCredential;
import com.signup.identity.domain.PlainCredential;
import com.signup.identity.domain.User;
import com.signup.identity.domain.UserId;
import com.signup.identity.error.RegistrationException;
import com.signup.identity.port.CredentialHasher;
import com.signup.identity.port.DomainEventPublisher;
import com.signup.identity.port.DuplicateEmailException;
import com.signup.identity.port.IdentifierGenerator;
import com.signup.identity.port.UserRepository;
import com.signup.identity.validation.CredentialPolicy;
import com.signup.identity.validation.EmailFormat;
import com.signup.identity.validation.IdentifierFormat;
import com.signup.identity.validation.InputValidator;
import com.signup.identity.validation.ValidatedInput;
import com.signup.metrics.MetricsRecorder;
import com.signup.metrics.SimpleMetricsRecorder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * "Register a user" as an ordered chain of fallible steps:
 * validate, check uniqueness, hash, build the entity, persist, publish.
 * <p>
 * Stateless between runs; one instance may serve concurrent registrations. The uniqueness
 * lookup is best-effort, the repository's constraint on save is what actually prevents duplicates.
 * Because the event is published after the user is stored, an {@code EVENT_PUBLICATION}
 * failure means the user exists anyway.
 */
public final class RegisterUserPipeline {
  public static final String DEFAULT_NAME = "register_user";
  public static final String CONFLICT_MESSAGE = "Email already exists.";

  private final IdentifierGenerator identifierGenerator;
  private final CredentialHasher credentialHasher;
  private final UserRepository userRepository;
  private final DomainEventPublisher eventPublisher;
  private final InputValidator validator;
  private final EmailFormat emailFormat;
  private final CredentialPolicy credentialPolicy;
  private final Pipe<RegisterUser, Void> pipe;

  private RegisterUserPipeline(Builder b) {
    this.identifierGenerator = Objects.requireNonNull(b.identifierGenerator, "identifierGenerator");
    this.credentialHasher = Objects.requireNonNull(b.credentialHasher, "credentialHasher");
    this.userRepository = Objects.requireNonNull(b.userRepository, "userRepository");
    this.eventPublisher = Objects.requireNonNull(b.eventPublisher, "eventPublisher");
    this.emailFormat = b.emailFormat;
    this.credentialPolicy = b.credentialPolicy;
    this.validator = new InputValidator(b.logger);
    this.pipe = Pipe.<RegisterUser>named(b.name)
        .logger(b.logger)
        .recorder(b.recorder)
        .step("validate input", this::validateInput)
        .step("get user by email", this::lookupExistingUser)
        .step("check email uniqueness", this::requireUnusedEmail)
        .step("hash plain credential", this::hashCredential)
        .step("build user entity", Steps.attempt(RegisterUserPipeline::buildUser, RegistrationException::entityConstruction))
        .step("save user in storage", this::saveUser)
        .step("emit user created event", this::publishUserCreated)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String name() {
    return pipe.name();
  }

  /** Step tags in execution order, as they appear in logs and metric tags. */
  public List<String> stepTags() {
    return pipe.tags();
  }

  /** Runs one registration. The future always completes normally; failures are in the outcome. */
  public CompletableFuture<Outcome<Void>> run(RegisterUser command) {
    Objects.requireNonNull(command, "command");
    return pipe.run(command);
  }

  public CompletableFuture<Outcome<Void>> run(String email, String credential) {
    return run(new RegisterUser(email, credential));
  }

  // --- steps ---

  private CompletableFuture<Outcome<ValidatedInput>> validateInput(RegisterUser command) {
    CompletableFuture<Outcome<UserId>> id = Steps.perform(
            (Void ignored) -> identifierGenerator.generateIdentifier(),
            ex -> validator.reject("id", "identifier generation failed", ex))
        .apply(null)
        .thenApply(generated -> generated.flatMap(raw -> validator.validate(raw, IdentifierFormat.UUID, "id")));
    CompletableFuture<Outcome<EmailAddress>> email =
        CompletableFuture.supplyAsync(() -> validator.validate(command.email(), emailFormat, "email"));
    CompletableFuture<Outcome<PlainCredential>> credential =
        CompletableFuture.supplyAsync(() -> validator.validate(command.credential(), credentialPolicy, "credential"));
    return Gather.all(id, email, credential, ValidatedInput::new);
  }

  private CompletableFuture<Outcome<ExistingUserLookup>> lookupExistingUser(ValidatedInput input) {
    AsyncStep<EmailAddress, Optional<User>> findByEmail = Steps.perform(
        userRepository::findByEmail,
        ex -> RegistrationException.persistence("User lookup failed.", ex));
    return Gather.both(findByEmail.apply(input.email()), Steps.carry(input), ExistingUserLookup::new);
  }

  private CompletableFuture<Outcome<ValidatedInput>> requireUnusedEmail(ExistingUserLookup lookup) {
    if (lookup.existing().isPresent()) return Steps.fail(RegistrationException.conflict(CONFLICT_MESSAGE));
    return Steps.carry(lookup.input());
  }

  private CompletableFuture<Outcome<HashedInput>> hashCredential(ValidatedInput input) {
    AsyncStep<PlainCredential, HashedCredential> hash = Steps.perform(credentialHasher::hash, RegistrationException::hashing);
    return Gather.both(hash.apply(input.credential()), Steps.carry(input), HashedInput::new);
  }

  private static User buildUser(HashedInput hashed) {
    return new User(hashed.input().id(), hashed.input().email(), hashed.credential());
  }

  private CompletableFuture<Outcome<User>> saveUser(User user) {
    AsyncStep<User, Void> save = Steps.perform(userRepository::save, RegisterUserPipeline::classifySaveFailure);
    return save.apply(user).thenApply(stored -> stored.map(ignored -> user));
  }

  private CompletableFuture<Outcome<Void>> publishUserCreated(User user) {
    AsyncStep<DomainEvent, Void> publish = Steps.perform(eventPublisher::publish, RegistrationException::eventPublication);
    return publish.apply(DomainEvent.userCreated(eventEmail(user)));
  }

  /**
   * Email carried by the USER_CREATED event. Taken from the stored entity, i.e. the validated,
   * canonical address, never from the raw request.
   */
  static String eventEmail(User user) {
    return user.email().value();
  }

  private static Exception classifySaveFailure(Exception ex) {
    if (ex instanceof DuplicateEmailException) return RegistrationException.conflict(CONFLICT_MESSAGE, ex);
    return RegistrationException.persistence("User could not be stored.", ex);
  }

  private record ExistingUserLookup(Optional<User> existing, ValidatedInput input) {}

  private record HashedInput(HashedCredential credential, ValidatedInput input) {}

  public static final class Builder {
    private String name = DEFAULT_NAME;
    private IdentifierGenerator identifierGenerator;
    private CredentialHasher credentialHasher;
    private UserRepository userRepository;
    private DomainEventPublisher eventPublisher;
    private EmailFormat emailFormat = EmailFormat.DEFAULT;
    private CredentialPolicy credentialPolicy = CredentialPolicy.DEFAULT;
    private StepLogger logger;
    private MetricsRecorder recorder;

    private Builder() {}

    public Builder name(String name) { this.name = Objects.requireNonNull(name, "name"); return this; }
    public Builder identifierGenerator(IdentifierGenerator g) { this.identifierGenerator = g; return this; }
    public Builder credentialHasher(CredentialHasher h) { this.credentialHasher = h; return this; }
    public Builder userRepository(UserRepository r) { this.userRepository = r; return this; }
    public Builder eventPublisher(DomainEventPublisher p) { this.eventPublisher = p; return this; }
    public Builder emailFormat(EmailFormat f) { this.emailFormat = Objects.requireNonNull(f, "emailFormat"); return this; }
    public Builder credentialPolicy(CredentialPolicy p) { this.credentialPolicy = Objects.requireNonNull(p, "credentialPolicy"); return this; }
    public Builder logger(StepLogger l) { this.logger = Objects.requireNonNull(l, "logger"); return this; }
    public Builder recorder(MetricsRecorder r) { this.recorder = Objects.requireNonNull(r, "recorder"); return this; }

    public RegisterUserPipeline build() {
      if (logger == null) logger = new Slf4jStepLogger("SignUp");
      if (recorder == null) recorder = new SimpleMetricsRecorder();
      return new RegisterUserPipeline(this);
    }
  }
}
