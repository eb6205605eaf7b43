package com.codeheadsystems.sessionkey.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.codeheadsystems.sessionkey.model.SessionKeyNotFoundException;
import com.codeheadsystems.sessionkey.model.api.ExecuteRequest;
import com.codeheadsystems.sessionkey.model.api.ExecuteResponse;
import com.codeheadsystems.sessionkey.model.api.RevokeRequest;
import com.codeheadsystems.sessionkey.model.api.RevokeResponse;
import com.codeheadsystems.sessionkey.model.api.SessionKeyListResponse;
import com.codeheadsystems.sessionkey.server.manager.SessionKeyServerManager;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.RuntimeDelegate;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionKeyResourceTest {

  private static final String WALLET = "0xwallet";
  private static final String ID = "sk_1";
  private static final AtomicInteger lastStatus = new AtomicInteger();

  @Mock private SessionKeyServerManager manager;
  private SessionKeyResource resource;

  @BeforeAll
  static void installRuntimeDelegate() {
    // WebApplicationException needs a JAX-RS RuntimeDelegate; without a container we install a
    // mock whose responses report the status the exception was built with.
    RuntimeDelegate mockRd = mock(RuntimeDelegate.class);
    Response.ResponseBuilder mockBuilder = mock(Response.ResponseBuilder.class, Mockito.RETURNS_SELF);
    Response mockResponse = mock(Response.class);

    when(mockRd.createResponseBuilder()).thenReturn(mockBuilder);
    when(mockBuilder.status(any(Response.StatusType.class))).thenAnswer(i -> {
      lastStatus.set(i.<Response.StatusType>getArgument(0).getStatusCode());
      return mockBuilder;
    });
    when(mockBuilder.status(any(Response.Status.class))).thenAnswer(i -> {
      lastStatus.set(i.<Response.Status>getArgument(0).getStatusCode());
      return mockBuilder;
    });
    when(mockBuilder.status(anyInt(), anyString())).thenAnswer(i -> {
      lastStatus.set(i.<Integer>getArgument(0));
      return mockBuilder;
    });
    when(mockBuilder.build()).thenReturn(mockResponse);
    when(mockResponse.getStatus()).thenAnswer(i -> lastStatus.get());

    RuntimeDelegate.setInstance(mockRd);
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    RuntimeDelegate.setInstance(null);
  }

  @BeforeEach
  void setUp() {
    resource = new SessionKeyResource(manager);
  }

  private static int statusOf(Throwable e) {
    return ((WebApplicationException) e).getResponse().getStatus();
  }

  @Test
  void listActive_returnsManagerResult() {
    when(manager.listActive(WALLET)).thenReturn(new SessionKeyListResponse(List.of(ID)));

    assertThat(resource.listActive(WALLET).sessionKeyIds()).containsExactly(ID);
  }

  @Test
  void execute_policyDenialIsABody() {
    ExecuteRequest request = new ExecuteRequest("0xaa", "transfer", "1", null, null);
    ExecuteResponse denied = new ExecuteResponse(false, null, null, "POLICY_DENIED", "REVOKED",
        "Session key revoked", null);
    when(manager.execute(WALLET, ID, request)).thenReturn(denied);

    assertThat(resource.execute(WALLET, ID, request)).isEqualTo(denied);
  }

  @Test
  void get_notFound_throws404() {
    when(manager.get(WALLET, ID)).thenThrow(new SessionKeyNotFoundException(ID));

    assertThatThrownBy(() -> resource.get(WALLET, ID))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf(e)).isEqualTo(Response.Status.NOT_FOUND.getStatusCode()));
  }

  @Test
  void execute_badInput_throws400() {
    ExecuteRequest request = new ExecuteRequest("0xaa", "transfer", "-5", null, null);
    when(manager.execute(WALLET, ID, request)).thenThrow(new IllegalArgumentException("amount must not be negative"));

    assertThatThrownBy(() -> resource.execute(WALLET, ID, request))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf(e)).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode()));
  }

  @Test
  void revoke_storeFailure_throws503() {
    RevokeRequest request = new RevokeRequest("r");
    when(manager.revoke(WALLET, ID, request))
        .thenThrow(new UncheckedIOException("disk full", new IOException("disk full")));

    assertThatThrownBy(() -> resource.revoke(WALLET, ID, request))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf(e)).isEqualTo(Response.Status.SERVICE_UNAVAILABLE.getStatusCode()));
  }

  @Test
  void emergencyRevoke_passesThrough() {
    when(manager.emergencyRevoke(WALLET, null)).thenReturn(new RevokeResponse(true, 3));

    assertThat(resource.emergencyRevoke(WALLET, null).count()).isEqualTo(3);
  }

  @Test
  void createForTier_unknownTier_throws400() {
    when(manager.createForTier(WALLET, "giant", null)).thenThrow(new IllegalArgumentException("Unknown tier"));

    assertThatThrownBy(() -> resource.createForTier(WALLET, "giant", null))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf(e)).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode()));
  }
}
