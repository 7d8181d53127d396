package com.gentoro.recordbridge.auth;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.recordbridge.exception.AuthenticationException;
import com.gentoro.recordbridge.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthSessionManagerTest {

  private static final Duration MARGIN = Duration.ofSeconds(60);

  @Mock private Authenticator authenticator;

  private MutableClock clock;
  private AuthSessionManager manager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    manager = new AuthSessionManager(authenticator, MARGIN, clock);
  }

  private Credential credential(String token, Duration validity) {
    return new Credential(token, "refresh", clock.instant().plus(validity));
  }

  @Test
  void firstRequestLogsInAndLaterRequestsReuseTheCredential() {
    Credential first = credential("t1", Duration.ofMinutes(15));
    when(authenticator.login()).thenReturn(first);

    assertEquals(SessionState.UNAUTHENTICATED, manager.state());
    assertSame(first, manager.credential());
    clock.advance(Duration.ofMinutes(10));
    assertSame(first, manager.credential());

    verify(authenticator, times(1)).login();
    verify(authenticator, never()).refresh(any());
    assertEquals(SessionState.AUTHENTICATED, manager.state());
  }

  @Test
  void refreshesOnceWhenInsideTheSafetyMargin() {
    Credential first = credential("t1", Duration.ofMinutes(15));
    when(authenticator.login()).thenReturn(first);
    manager.credential();

    clock.advance(Duration.ofMinutes(14).plusSeconds(1));
    Credential second = credential("t2", Duration.ofMinutes(15));
    when(authenticator.refresh(first)).thenReturn(second);

    assertSame(second, manager.credential());
    assertSame(second, manager.credential());
    verify(authenticator, times(1)).refresh(first);
    verify(authenticator, times(1)).login();
  }

  @Test
  void failedRefreshFallsBackToOneLogin() {
    Credential first = credential("t1", Duration.ofMinutes(15));
    Credential second = credential("t2", Duration.ofMinutes(30));
    when(authenticator.login()).thenReturn(first, second);
    manager.credential();

    clock.advance(Duration.ofMinutes(15));
    when(authenticator.refresh(first)).thenThrow(new AuthenticationException("refresh denied"));

    assertSame(second, manager.credential());
    verify(authenticator, times(2)).login();
  }

  @Test
  void failedLoginSurfacesAsAuthenticationError() {
    when(authenticator.login()).thenThrow(new IllegalStateException("connection refused"));

    AuthenticationException ex =
        assertThrows(AuthenticationException.class, () -> manager.credential());
    assertTrue(ex.getMessage().contains("connection refused"));
    assertEquals(SessionState.UNAUTHENTICATED, manager.state());
  }

  @Test
  void concurrentCallersShareASingleLogin() throws Exception {
    AtomicInteger logins = new AtomicInteger();
    CountDownLatch loginStarted = new CountDownLatch(1);
    CountDownLatch releaseLogin = new CountDownLatch(1);
    Authenticator slow =
        new Authenticator() {
          @Override
          public Credential login() {
            logins.incrementAndGet();
            loginStarted.countDown();
            try {
              releaseLogin.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return credential("shared", Duration.ofMinutes(15));
          }

          @Override
          public Credential refresh(Credential current) {
            throw new UnsupportedOperationException();
          }

          @Override
          public void logout(Credential current) {}
        };
    AuthSessionManager shared = new AuthSessionManager(slow, MARGIN, clock);

    int callers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    try {
      List<Future<Credential>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(pool.submit(shared::credential));
      }
      assertTrue(loginStarted.await(5, TimeUnit.SECONDS));
      // let the other callers pile up on the monitor
      Thread.sleep(100);
      releaseLogin.countDown();

      for (Future<Credential> f : futures) {
        assertEquals("shared", f.get(5, TimeUnit.SECONDS).accessToken());
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, logins.get());
  }

  @Test
  void concurrentCallersShareASingleRefresh() throws Exception {
    AtomicInteger logins = new AtomicInteger();
    AtomicInteger refreshes = new AtomicInteger();
    CountDownLatch refreshStarted = new CountDownLatch(1);
    CountDownLatch releaseRefresh = new CountDownLatch(1);
    Authenticator slow =
        new Authenticator() {
          @Override
          public Credential login() {
            logins.incrementAndGet();
            return credential("initial", Duration.ofMinutes(15));
          }

          @Override
          public Credential refresh(Credential current) {
            refreshes.incrementAndGet();
            refreshStarted.countDown();
            try {
              releaseRefresh.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return credential("refreshed", Duration.ofMinutes(15));
          }

          @Override
          public void logout(Credential current) {}
        };
    AuthSessionManager shared = new AuthSessionManager(slow, MARGIN, clock);
    assertEquals("initial", shared.credential().accessToken());

    // inside the safety margin of the initial credential
    clock.advance(Duration.ofMinutes(14).plusSeconds(30));

    int callers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    try {
      List<Future<Credential>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(pool.submit(shared::credential));
      }
      assertTrue(refreshStarted.await(5, TimeUnit.SECONDS));
      Thread.sleep(100);
      releaseRefresh.countDown();

      for (Future<Credential> f : futures) {
        assertEquals("refreshed", f.get(5, TimeUnit.SECONDS).accessToken());
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, refreshes.get());
    assertEquals(1, logins.get());
  }

  @Test
  void reauthenticateForcesALoginForTheRejectedCredential() {
    Credential first = credential("t1", Duration.ofMinutes(15));
    Credential second = credential("t2", Duration.ofMinutes(15));
    when(authenticator.login()).thenReturn(first, second);

    Credential rejected = manager.credential();
    assertSame(second, manager.reauthenticate(rejected));
    assertSame(second, manager.credential());
    verify(authenticator, times(2)).login();
    assertEquals(SessionState.AUTHENTICATED, manager.state());
  }

  @Test
  void reauthenticateReturnsAReplacementObtainedByAnotherCaller() {
    Credential first = credential("t1", Duration.ofMinutes(15));
    Credential second = credential("t2", Duration.ofMinutes(15));
    when(authenticator.login()).thenReturn(first, second);

    Credential stale = manager.credential();
    Credential replaced = manager.reauthenticate(stale);
    // a second caller still holding the stale token must not trigger another login
    assertSame(replaced, manager.reauthenticate(stale));
    verify(authenticator, times(2)).login();
  }

  @Test
  void logoutDropsTheCredentialEvenWhenTheBackendFails() {
    Credential first = credential("t1", Duration.ofMinutes(15));
    Credential second = credential("t2", Duration.ofMinutes(15));
    when(authenticator.login()).thenReturn(first, second);
    doThrow(new AuthenticationException("logout failed")).when(authenticator).logout(first);

    manager.credential();
    manager.logout();

    assertEquals(SessionState.UNAUTHENTICATED, manager.state());
    assertSame(second, manager.credential());
  }

  @Test
  void logoutWithoutSessionDoesNotCallTheBackend() {
    manager.logout();
    verifyNoInteractions(authenticator);
  }
}
