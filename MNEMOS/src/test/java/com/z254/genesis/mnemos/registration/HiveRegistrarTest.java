package com.z254.genesis.mnemos.registration;

import com.z254.genesis.mnemos.config.MnemosProperties;
import com.z254.genesis.mnemos.store.MemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.boot.web.server.WebServer;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HiveRegistrarTest {

    @Mock
    private HiveRegistrationClient client;

    @Mock
    private MemoryStore store;

    private MnemosProperties properties;
    private HiveRegistrar registrar;

    @BeforeEach
    void setUp() {
        properties = new MnemosProperties();
        registrar = new HiveRegistrar(client, store, properties);
    }

    private void serverStarted(int port) {
        WebServer webServer = mock(WebServer.class);
        when(webServer.getPort()).thenReturn(port);
        WebServerInitializedEvent event = mock(WebServerInitializedEvent.class);
        when(event.getWebServer()).thenReturn(webServer);
        registrar.onWebServerInitialized(event);
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("should register with a generated id and the local address by default")
        void registersOnStartup() {
            when(client.isEnabled()).thenReturn(true);
            when(client.register(any())).thenReturn(Mono.empty());

            serverStarted(8101);

            ArgumentCaptor<HiveRegistrationClient.Registration> captor =
                    ArgumentCaptor.forClass(HiveRegistrationClient.Registration.class);
            verify(client).register(captor.capture());
            HiveRegistrationClient.Registration sent = captor.getValue();
            assertThat(sent.id()).startsWith("memory-");
            assertThat(sent.role()).isEqualTo("memory");
            assertThat(sent.address()).isEqualTo("http://localhost:8101");
            assertThat(sent.capabilities()).contains("memory.search", "memory.backup");
        }

        @Test
        @DisplayName("should prefer the configured id and advertised address")
        void configuredIdentity() {
            properties.getHive().setInstanceId("mnemos-1");
            properties.getHive().setAdvertisedAddress("http://mnemos-1:8101");
            when(client.isEnabled()).thenReturn(true);
            when(client.register(any())).thenReturn(Mono.empty());

            serverStarted(8101);

            assertThat(registrar.registration().id()).isEqualTo("mnemos-1");
            assertThat(registrar.registration().address()).isEqualTo("http://mnemos-1:8101");
        }

        @Test
        @DisplayName("should survive a failed initial registration")
        void failedRegistrationIsNotFatal() {
            when(client.isEnabled()).thenReturn(true);
            when(client.register(any())).thenReturn(Mono.error(new IllegalStateException("hub down")));

            serverStarted(8101);

            assertThat(registrar.registration()).isNotNull();
        }

        @Test
        @DisplayName("should do nothing without a hub")
        void stubModeSkipsEverything() {
            when(client.isEnabled()).thenReturn(false);

            serverStarted(8101);
            registrar.heartbeat();
            registrar.deregister();

            verify(client, never()).register(any());
            verify(client, never()).heartbeat(anyString(), anyString());
            verify(client, never()).deregister(anyString());
        }
    }

    @Nested
    @DisplayName("Heartbeats")
    class HeartbeatTests {

        @BeforeEach
        void registered() {
            properties.getHive().setInstanceId("mnemos-1");
            when(client.isEnabled()).thenReturn(true);
            when(client.register(any())).thenReturn(Mono.empty());
            serverStarted(8101);
        }

        @Test
        @DisplayName("should report healthy while the store is writable")
        void healthy() {
            when(store.isWritable()).thenReturn(true);
            when(client.heartbeat("mnemos-1", "healthy")).thenReturn(Mono.just(true));

            registrar.heartbeat();

            verify(client).heartbeat("mnemos-1", "healthy");
            verify(client, times(1)).register(any());
        }

        @Test
        @DisplayName("should report degraded when the store is not writable")
        void degraded() {
            when(store.isWritable()).thenReturn(false);
            when(client.heartbeat("mnemos-1", "degraded")).thenReturn(Mono.just(true));

            registrar.heartbeat();

            verify(client).heartbeat("mnemos-1", "degraded");
        }

        @Test
        @DisplayName("should register again when the hub has forgotten the instance")
        void reRegistersWhenUnknown() {
            when(store.isWritable()).thenReturn(true);
            when(client.heartbeat(eq("mnemos-1"), anyString())).thenReturn(Mono.just(false));

            registrar.heartbeat();

            verify(client, times(2)).register(any());
        }

        @Test
        @DisplayName("should deregister on shutdown")
        void deregistersOnShutdown() {
            when(client.deregister("mnemos-1")).thenReturn(Mono.empty());

            registrar.deregister();

            verify(client).deregister("mnemos-1");
        }

        @Test
        @DisplayName("should not fail shutdown when deregistration fails")
        void deregistrationFailureIsLogged() {
            when(client.deregister("mnemos-1")).thenReturn(Mono.error(new IllegalStateException("hub down")));

            registrar.deregister();

            verify(client).deregister("mnemos-1");
        }
    }

    @Nested
    @DisplayName("Client stub mode")
    class StubClientTests {

        @Test
        @DisplayName("should complete every call without a hub URL")
        void stubClient() {
            HiveRegistrationClient stub = new HiveRegistrationClient(WebClient.builder(), new MnemosProperties());

            assertThat(stub.isEnabled()).isFalse();
            StepVerifier.create(stub.register(new HiveRegistrationClient.Registration(
                            "mnemos-1", "memory", "http://localhost:8101", List.of())))
                    .verifyComplete();
            StepVerifier.create(stub.heartbeat("mnemos-1", "healthy"))
                    .expectNext(true)
                    .verifyComplete();
            StepVerifier.create(stub.deregister("mnemos-1"))
                    .verifyComplete();
        }
    }
}
