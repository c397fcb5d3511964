/*
 * Copyright (c) 2025 Cumulocity GmbH.
 *
 * SPDX-License-Identifier: Apache-2.0
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 *  @authors Christof Strack, Stefan Witschel
 *
 */

package pulsar.mapper.connector;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.ConsumerBuilder;
import org.apache.pulsar.client.api.DeadLetterPolicy;
import org.apache.pulsar.client.api.MessageListener;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.SubscriptionType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import pulsar.mapper.MapperTestHelper;
import pulsar.mapper.configuration.ServiceConfiguration;
import pulsar.mapper.model.ConnectorStatus;
import pulsar.mapper.model.TenantContext;
import pulsar.mapper.processor.MessageProcessor;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TenantConsumerTest {

    @Mock
    private PulsarClientFactory pulsarClientFactory;
    @Mock
    private MessageProcessor messageProcessor;
    @Mock
    private PulsarClient pulsarClient;
    @Mock(answer = Answers.RETURNS_SELF)
    private ConsumerBuilder<byte[]> consumerBuilder;
    @Mock
    private Consumer<byte[]> platformConsumer;

    private ExecutorService processingThreadPool;
    private ServiceConfiguration serviceConfiguration;
    private TenantContext tenantContext;
    private TenantConsumer tenantConsumer;

    @BeforeEach
    void setUp() throws Exception {
        processingThreadPool = Executors.newFixedThreadPool(2);
        serviceConfiguration = MapperTestHelper.serviceConfiguration();
        tenantContext = MapperTestHelper.tenantContext(MapperTestHelper.TEST_TENANT);
        tenantConsumer = new TenantConsumer(tenantContext, pulsarClientFactory, messageProcessor,
                processingThreadPool, serviceConfiguration);

        lenient().when(pulsarClientFactory.createClient(tenantContext)).thenReturn(pulsarClient);
        lenient().when(pulsarClient.newConsumer()).thenReturn(consumerBuilder);
        lenient().when(consumerBuilder.subscribe()).thenReturn(platformConsumer);
        lenient().when(platformConsumer.isConnected()).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        processingThreadPool.shutdownNow();
    }

    @Test
    void testConnectSubscribesSharedToTenantTopic() throws Exception {
        tenantConsumer.connect();

        assertTrue(tenantConsumer.isConnected());
        assertEquals(ConnectorStatus.CONNECTED, tenantConsumer.getStatus().getStatus());
        verify(consumerBuilder).topic("persistent://t100/mqtt/from-device");
        verify(consumerBuilder).subscriptionName("pulsar-mapper");
        verify(consumerBuilder).subscriptionType(SubscriptionType.Shared);
        verify(consumerBuilder).negativeAckRedeliveryDelay(10L, TimeUnit.SECONDS);
        verify(consumerBuilder).messageListener(any(MessageListener.class));
        verify(consumerBuilder, never()).deadLetterPolicy(any(DeadLetterPolicy.class));
    }

    @Test
    void testDeadLetterTopicIsResolvedPerTenant() throws Exception {
        serviceConfiguration.setDeadLetterTopic("persistent://{tenant}/mqtt/pulsar-mapper-dlq");

        tenantConsumer.connect();

        ArgumentCaptor<DeadLetterPolicy> captor = ArgumentCaptor.forClass(DeadLetterPolicy.class);
        verify(consumerBuilder).deadLetterPolicy(captor.capture());
        assertEquals("persistent://t100/mqtt/pulsar-mapper-dlq", captor.getValue().getDeadLetterTopic());
        assertEquals(3, captor.getValue().getMaxRedeliverCount());
    }

    @Test
    void testConnectRetriesUnavailableBroker() throws Exception {
        when(consumerBuilder.subscribe())
                .thenThrow(new PulsarClientException("broker unavailable"))
                .thenReturn(platformConsumer);

        tenantConsumer.connect();

        assertTrue(tenantConsumer.isConnected());
        verify(consumerBuilder, times(2)).subscribe();
        // the client is reused across attempts
        verify(pulsarClientFactory, times(1)).createClient(tenantContext);
    }

    @Test
    void testConnectGivesUpAfterMaxAttempts() throws Exception {
        when(consumerBuilder.subscribe()).thenThrow(new PulsarClientException("broker unavailable"));

        ConnectorException exception = assertThrows(ConnectorException.class, () -> tenantConsumer.connect());

        assertTrue(exception.isRecoverable());
        verify(consumerBuilder, times(serviceConfiguration.getConnectMaxAttempts())).subscribe();
        verify(pulsarClient).close();
        assertFalse(tenantConsumer.isConnected());
        assertEquals(ConnectorStatus.FAILED, tenantConsumer.getStatus().getStatus());
        assertTrue(tenantConsumer.getStatus().getMessage().contains("broker unavailable"));
    }

    @Test
    void testRejectedCredentialsAreNotRetried() throws Exception {
        when(consumerBuilder.subscribe())
                .thenThrow(new PulsarClientException.AuthenticationException("invalid credentials"));

        ConnectorException exception = assertThrows(ConnectorException.class, () -> tenantConsumer.connect());

        assertFalse(exception.isRecoverable());
        verify(consumerBuilder, times(1)).subscribe();
        verify(pulsarClient).close();
        assertEquals(ConnectorStatus.FAILED, tenantConsumer.getStatus().getStatus());
    }

    @Test
    void testStopAcceptingPausesConsumer() throws Exception {
        tenantConsumer.connect();

        tenantConsumer.stopAccepting();

        assertFalse(tenantConsumer.getCallback().isAccepting());
        verify(platformConsumer).pause();
    }

    @Test
    void testDisconnectClosesConsumerAndClient() throws Exception {
        tenantConsumer.connect();

        tenantConsumer.disconnect();

        verify(platformConsumer).close();
        verify(pulsarClient).close();
        assertFalse(tenantConsumer.isConnected());
        assertEquals(ConnectorStatus.DISCONNECTED, tenantConsumer.getStatus().getStatus());
    }
}
