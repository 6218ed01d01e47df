package com.signup.identity.adapter;

import com.signup.identity.domain.DomainEvent;
import com.signup.identity.domain.EmailAddress;
import com.signup.identity.domain.HashedCredential;
import com.signup.identity.domain.User;
import com.signup.identity.domain.UserId;
import com.signup.identity.port.DuplicateEmailException;
import com.signup.identity.port.EventDeliveryException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static com.signup.identity.domain.EventKind.USER_CREATED;
import static org.junit.jupiter.api.Assertions.*;

final class InMemoryAdaptersTest {

  private static User user(String id, String email) {
    return new User(new UserId(id), new EmailAddress(email), new HashedCredential("pbkdf2$1$c2FsdA$aGFzaA"));
  }

  @Test
  void repositoryEnforcesEmailUniqueness() {
    InMemoryUserRepository repo = new InMemoryUserRepository();
    User first = user("00000000-0000-0000-0000-000000000001", "a@example.com");

    assertNull(repo.save(first).join());
    assertEquals(first, repo.findByEmail(new EmailAddress("a@example.com")).join().orElseThrow());

    CompletionException ex = assertThrows(CompletionException.class,
        () -> repo.save(user("00000000-0000-0000-0000-000000000002", "a@example.com")).join());
    assertInstanceOf(DuplicateEmailException.class, ex.getCause());
    assertEquals(1, repo.size());
    assertEquals(List.of(first), repo.all());
  }

  @Test
  void repositoryLookupOfUnknownEmailIsEmpty() {
    assertTrue(new InMemoryUserRepository().findByEmail(new EmailAddress("nobody@example.com")).join().isEmpty());
  }

  @Test
  void publisherDeliversInSubscriptionOrder() {
    List<String> seen = new ArrayList<>();
    InMemoryDomainEventPublisher publisher = new InMemoryDomainEventPublisher()
        .subscribe(USER_CREATED, e -> seen.add("first:" + e.payload().get("email")))
        .subscribe(USER_CREATED, e -> seen.add("second:" + e.payload().get("email")));

    publisher.publish(DomainEvent.userCreated("a@example.com")).join();

    assertEquals(List.of("first:a@example.com", "second:a@example.com"), seen);
    assertEquals(List.of(DomainEvent.userCreated("a@example.com")), publisher.published());
  }

  @Test
  void throwingListenerFailsThePublication() {
    InMemoryDomainEventPublisher publisher = new InMemoryDomainEventPublisher()
        .subscribe(USER_CREATED, e -> { throw new IllegalStateException("broker offline"); });

    CompletionException ex = assertThrows(CompletionException.class,
        () -> publisher.publish(DomainEvent.userCreated("a@example.com")).join());
    EventDeliveryException delivery = assertInstanceOf(EventDeliveryException.class, ex.getCause());
    assertEquals("broker offline", delivery.getCause().getMessage());
  }

  @Test
  void failedPublicationIsNotListedAsPublished() {
    List<String> seen = new ArrayList<>();
    InMemoryDomainEventPublisher publisher = new InMemoryDomainEventPublisher()
        .subscribe(USER_CREATED, e -> seen.add("audit"))
        .subscribe(USER_CREATED, e -> { throw new IllegalStateException("broker offline"); });

    assertThrows(CompletionException.class, () -> publisher.publish(DomainEvent.userCreated("a@example.com")).join());

    assertEquals(List.of("audit"), seen);
    assertTrue(publisher.published().isEmpty());
  }

  @Test
  void uuidGeneratorProducesDistinctIdentifiers() {
    UuidIdentifierGenerator generator = new UuidIdentifierGenerator();
    String a = generator.generateIdentifier().join();
    String b = generator.generateIdentifier().join();

    assertNotEquals(a, b);
    assertEquals(36, a.length());
  }
}
