package org.javai.reconnect.analysis;

import org.javai.reconnect.DisconnectCause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DefaultDisconnectClassifierTest {

    private DefaultDisconnectClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new DefaultDisconnectClassifier();
    }

    @Test
    void pingTimeout_isNetworkTimeout() {
        assertThat(classifier.classify("ping timeout")).isEqualTo(DisconnectCause.NETWORK_TIMEOUT);
        assertThat(classifier.classify("socket closed: ping timeout after 20000ms"))
                .isEqualTo(DisconnectCause.NETWORK_TIMEOUT);
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertThat(classifier.classify("PING TIMEOUT")).isEqualTo(DisconnectCause.NETWORK_TIMEOUT);
        assertThat(classifier.classify("Transport Close")).isEqualTo(DisconnectCause.TRANSPORT_ERROR);
    }

    @Test
    void everyKeyword_mapsToItsCause() {
        assertThat(classifier.classify("connection timeout")).isEqualTo(DisconnectCause.NETWORK_TIMEOUT);
        assertThat(classifier.classify("transport close")).isEqualTo(DisconnectCause.TRANSPORT_ERROR);
        assertThat(classifier.classify("transport error")).isEqualTo(DisconnectCause.TRANSPORT_ERROR);
        assertThat(classifier.classify("client namespace disconnect")).isEqualTo(DisconnectCause.USER_INITIATED);
        assertThat(classifier.classify("io server disconnect")).isEqualTo(DisconnectCause.SERVER_SHUTDOWN);
        assertThat(classifier.classify("server error")).isEqualTo(DisconnectCause.SERVER_SHUTDOWN);
        assertThat(classifier.classify("auth failed")).isEqualTo(DisconnectCause.AUTHENTICATION_FAILURE);
        assertThat(classifier.classify("resource limit reached")).isEqualTo(DisconnectCause.RESOURCE_EXHAUSTION);
    }

    @Test
    void firstMatchInTableOrderWins() {
        // "transport close" comes before "server error" in the table
        assertThat(classifier.classify("server error after transport close"))
                .isEqualTo(DisconnectCause.TRANSPORT_ERROR);
        // "ping timeout" comes before "auth failed"
        assertThat(classifier.classify("auth failed then ping timeout"))
                .isEqualTo(DisconnectCause.NETWORK_TIMEOUT);
    }

    @Test
    void partialKeyword_doesNotMatch() {
        assertThat(classifier.classify("timeout")).isEqualTo(DisconnectCause.UNKNOWN);
        assertThat(classifier.classify("transport")).isEqualTo(DisconnectCause.UNKNOWN);
    }

    @Test
    void unknownNullAndBlankReasons_areUnknown() {
        assertThat(classifier.classify("cosmic rays")).isEqualTo(DisconnectCause.UNKNOWN);
        assertThat(classifier.classify("")).isEqualTo(DisconnectCause.UNKNOWN);
        assertThat(classifier.classify("   ")).isEqualTo(DisconnectCause.UNKNOWN);
        assertThat(classifier.classify(null)).isEqualTo(DisconnectCause.UNKNOWN);
    }
}
