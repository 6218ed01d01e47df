package com.signup.identity.command;

import com.signup.core.Outcome;
import com.signup.identity.domain.DomainEvent;
import com.signup.identity.domain.EmailAddress;
import com.signup.identity.domain.EventKind;
import com.signup.identity.domain.HashedCredential;
import com.signup.identity.domain.User;
import com.signup.identity.domain.UserId;
import com.signup.identity.error.ErrorKind;
import com.signup.identity.error.RegistrationException;
import com.signup.identity.error.ValidationException;
import com.signup.identity.port.DuplicateEmailException;
import com.signup.identity.port.EventDeliveryException;
import com.signup.identity.port.HashingFailedException;
import com.signup.identity.port.StorageException;
import com.signup.identity.validation.CredentialPolicy;
import com.signup.metrics.SimpleMetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RegisterUserPipelineTest {
  private ScriptedCollaborators ports;
  private RecordingLogger logger;
  private RegisterUserPipeline pipeline;

  @BeforeEach
  void setup() {
    ports = new ScriptedCollaborators();
    logger = new RecordingLogger();
    pipeline = ports.pipeline().logger(logger).build();
  }

  @Test
  void newUserIsStoredAndAnnounced() {
    Outcome<Void> out = pipeline.run("new@example.com", "Secret123!").join();

    assertTrue(out.isSuccess());
    assertEquals(1, ports.saved.size());
    User user = ports.saved.get(0);
    assertEquals(new EmailAddress("new@example.com"), user.email());
    assertEquals(new UserId(ScriptedCollaborators.FIXED_ID), user.id());
    assertNotEquals("Secret123!", user.credential().value());
    assertEquals(List.of(new DomainEvent(EventKind.USER_CREATED, Map.of("email", "new@example.com"))), ports.events);
  }

  @Test
  void collaboratorsRunInPipelineOrder() {
    pipeline.run("new@example.com", "Secret123!").join();

    assertEquals(List.of("generateIdentifier", "findByEmail:new@example.com", "hash", "save", "publish"), ports.calls);
  }

  @Test
  void existingEmailIsAConflictAndNothingIsWritten() {
    ports.store.put("dup@example.com", existingUser("dup@example.com"));

    Outcome<Void> out = pipeline.run("dup@example.com", "x").join();

    RegistrationException failure = (RegistrationException) out.failure();
    assertEquals(ErrorKind.CONFLICT, failure.kind());
    assertEquals("Email already exists.", failure.getMessage());
    assertFalse(ports.calls.contains("hash"));
    assertFalse(ports.calls.contains("save"));
    assertFalse(ports.calls.contains("publish"));
  }

  @Test
  void malformedEmailIsRejectedBeforeAnyCollaborator() {
    Outcome<Void> out = pipeline.run("bad-email", "x").join();

    ValidationException failure = (ValidationException) out.failure();
    assertEquals(ErrorKind.VALIDATION, failure.kind());
    assertEquals("email", failure.field());
    assertEquals(List.of(), ports.collaboratorCallsBeyondValidation());
  }

  @Test
  void stepsRunUnderStableTags() {
    assertEquals(List.of("validate input", "get user by email", "check email uniqueness", "hash plain credential",
            "build user entity", "save user in storage", "emit user created event"),
        pipeline.stepTags());
  }

  @Test
  void emailWithForbiddenCharactersIsNeverStored() {
    for (String email : new String[] {"<a>@exa!mple.com;", "a..b@example.com", "a@b_c.com"}) {
      ValidationException failure = (ValidationException) pipeline.run(email, "x").join().failure();
      assertEquals("email", failure.field(), email);
    }
    assertEquals(List.of(), ports.collaboratorCallsBeyondValidation());
    assertTrue(ports.saved.isEmpty());
    assertTrue(ports.events.isEmpty());
  }

  @Test
  void emptyOrPolicyViolatingCredentialsAreRejected() {
    RegisterUserPipeline strict = ports.pipeline()
        .logger(logger)
        .credentialPolicy(new CredentialPolicy(8, 64, true, true, false))
        .build();

    for (String credential : new String[] {"", "short1", "longbutnodigits", "12345678901"}) {
      ValidationException failure = (ValidationException) strict.run("ok@example.com", credential).join().failure();
      assertEquals("credential", failure.field(), credential);
    }
    assertEquals(List.of(), ports.collaboratorCallsBeyondValidation());
  }

  @Test
  void nullRawValuesAreValidationFailures() {
    ValidationException failure = (ValidationException) pipeline.run(null, "x").join().failure();
    assertEquals("email", failure.field());

    failure = (ValidationException) pipeline.run("a@example.com", null).join().failure();
    assertEquals("credential", failure.field());
  }

  @Test
  void firstFailureInJoinOrderWinsWhenSeveralFieldsAreInvalid() {
    ports.nextId = "not-a-uuid";

    ValidationException failure = (ValidationException) pipeline.run("bad-email", "").join().failure();

    assertEquals("id", failure.field());
  }

  @Test
  void identifierGenerationFailureIsAValidationFailureOnId() {
    ports.generatorFailure = new IllegalStateException("entropy exhausted");

    ValidationException failure = (ValidationException) pipeline.run("new@example.com", "x").join().failure();

    assertEquals("id", failure.field());
    assertEquals("identifier generation failed", failure.reason());
    assertFalse(ports.calls.contains("save"));
  }

  @Test
  void validationFailuresAreLoggedSuccessesAreNot() {
    pipeline.run("new@example.com", "x").join();
    assertFalse(logger.events.stream().anyMatch(e -> e.startsWith("WARN:validate")));

    pipeline.run("bad-email", "x").join();
    assertTrue(logger.events.contains("WARN:validate email"));
    assertTrue(logger.events.contains("WARN:validate input"));
  }

  @Test
  void credentialNeverReachesTheLog() {
    pipeline.run("bad-email", "Secret123!").join();
    pipeline.run("ok@example.com", "").join();

    assertFalse(logger.rendered.stream().anyMatch(line -> line.contains("Secret123!")));
  }

  @Test
  void lookupFailureIsAPersistenceFailure() {
    ports.lookupFailure = new StorageException("connection refused");

    RegistrationException failure = (RegistrationException) pipeline.run("new@example.com", "x").join().failure();

    assertEquals(ErrorKind.PERSISTENCE, failure.kind());
    assertFalse(ports.calls.contains("hash"));
  }

  @Test
  void hashingFailureStopsBeforeStorage() {
    ports.hashFailure = new HashingFailedException("no provider", null);

    RegistrationException failure = (RegistrationException) pipeline.run("new@example.com", "x").join().failure();

    assertEquals(ErrorKind.HASHING, failure.kind());
    assertInstanceOf(HashingFailedException.class, failure.getCause());
    assertTrue(ports.saved.isEmpty());
  }

  @Test
  void rejectedEntityIsAnEntityConstructionFailure() {
    ports.hashYieldsNothing = true;

    RegistrationException failure = (RegistrationException) pipeline.run("new@example.com", "x").join().failure();

    assertEquals(ErrorKind.ENTITY_CONSTRUCTION, failure.kind());
    assertFalse(ports.calls.contains("save"));
  }

  @Test
  void saveFailureIsAPersistenceFailureAndNoEventIsSent() {
    ports.saveFailure = new StorageException("disk full");

    RegistrationException failure = (RegistrationException) pipeline.run("new@example.com", "x").join().failure();

    assertEquals(ErrorKind.PERSISTENCE, failure.kind());
    assertFalse(ports.calls.contains("publish"));
  }

  @Test
  void storageUniquenessViolationIsAConflict() {
    ports.saveFailure = new DuplicateEmailException("race@example.com");

    RegistrationException failure = (RegistrationException) pipeline.run("race@example.com", "x").join().failure();

    assertEquals(ErrorKind.CONFLICT, failure.kind());
    assertEquals(RegisterUserPipeline.CONFLICT_MESSAGE, failure.getMessage());
  }

  @Test
  void publishFailureAfterSaveLeavesTheUserStored() {
    ports.publishFailure = new EventDeliveryException("broker down", null);

    RegistrationException failure = (RegistrationException) pipeline.run("new@example.com", "x").join().failure();
    assertEquals(ErrorKind.EVENT_PUBLICATION, failure.kind());
    assertEquals(1, ports.saved.size());

    ports.publishFailure = null;
    RegistrationException retry = (RegistrationException) pipeline.run("new@example.com", "x").join().failure();
    assertEquals(ErrorKind.CONFLICT, retry.kind());
    assertEquals(1, ports.saved.size());
  }

  @Test
  void eventCarriesTheCanonicalEmail() {
    pipeline.run("  New@Example.COM ", "x").join();

    assertEquals("new@example.com", ports.saved.get(0).email().value());
    assertEquals("new@example.com", ports.events.get(0).payload().get("email"));
    assertEquals("new@example.com", RegisterUserPipeline.eventEmail(ports.saved.get(0)));
  }

  @Test
  void failingStepIsLoggedWithItsTag() {
    ports.store.put("dup@example.com", existingUser("dup@example.com"));

    pipeline.run("dup@example.com", "x").join();

    assertTrue(logger.events.contains("DEBUG:get user by email"));
    assertTrue(logger.events.contains("WARN:check email uniqueness"));
    assertFalse(logger.events.contains("DEBUG:hash plain credential"));
  }

  @Test
  void recordsMetricsPerStep() {
    SimpleMetricsRecorder recorder = new SimpleMetricsRecorder();
    RegisterUserPipeline metered = ports.pipeline().logger(logger).recorder(recorder).name("signup").build();

    metered.run("new@example.com", "x").join();

    assertEquals("signup", metered.name());
    assertNotNull(recorder.registry().find("signup.pipeline.signup.step.s6.duration").timer());
  }

  @Test
  void concurrentRegistrationsShareNoState() {
    var first = pipeline.run("one@example.com", "x");
    var second = pipeline.run("two@example.com", "y");

    assertTrue(first.join().isSuccess());
    assertTrue(second.join().isSuccess());
    assertEquals(2, ports.saved.size());
    assertEquals(2, ports.events.size());
  }

  @Test
  void builderRequiresEveryPort() {
    assertThrows(NullPointerException.class, () -> RegisterUserPipeline.builder().build());
  }

  private static User existingUser(String email) {
    return new User(new UserId("00000000-0000-0000-0000-000000000001"), new EmailAddress(email), new HashedCredential("stored"));
  }
}
