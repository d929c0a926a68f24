/*
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.example.s2s.voicebridge.telephony;

import com.example.s2s.voicebridge.telephony.TelephonyTestDoubles.FakeEngineFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class RegistrationSupervisorTest {

    private static final SipIdentity IDENTITY = new SipIdentity("1001", "pbx.local", 5060);

    private RegistrationSupervisor supervisor;

    private RegistrationSupervisor supervisor(FakeEngineFactory factory, int maxRetries) {
        supervisor = new RegistrationSupervisor(factory, null, IDENTITY, Duration.ofMillis(10), maxRetries,
                                                Duration.ofMillis(50), Duration.ofMillis(10));
        return supervisor;
    }

    @AfterEach
    void tearDown() {
        if (supervisor != null) {
            supervisor.shutdown();
        }
    }

    @Test
    void shouldRetryUntilRegistered() {
        FakeEngineFactory factory = new FakeEngineFactory(2);
        supervisor(factory, 0).start();

        await().atMost(2, TimeUnit.SECONDS).until(supervisor::isRegistered);

        assertThat(supervisor.getAttemptCount()).isEqualTo(3);
        assertThat(factory.engines).hasSize(3);
        assertThat(factory.engines.get(0).shutdowns.get()).isEqualTo(1);
        assertThat(factory.engines.get(1).shutdowns.get()).isEqualTo(1);
    }

    @Test
    void shouldGiveUpAfterMaxRetries() throws Exception {
        FakeEngineFactory factory = new FakeEngineFactory(Integer.MAX_VALUE);
        supervisor(factory, 3).start();

        assertThat(supervisor.awaitTermination(Duration.ofSeconds(2))).isTrue();

        assertThat(supervisor.getAttemptCount()).isEqualTo(3);
        assertThat(supervisor.isRegistered()).isFalse();
    }

    @Test
    void shouldReRegisterWithFreshEngineWhenRegistrationLost() {
        FakeEngineFactory factory = new FakeEngineFactory(0);
        supervisor(factory, 0).start();
        await().atMost(2, TimeUnit.SECONDS).until(supervisor::isRegistered);

        factory.engines.get(0).loseRegistration();

        await().atMost(2, TimeUnit.SECONDS).until(() -> factory.engines.size() == 2 && supervisor.isRegistered());
        assertThat(factory.engines.get(0).shutdowns.get()).isEqualTo(1);
    }

    @Test
    void shouldStopAndShutDownEngineOnShutdown() throws Exception {
        FakeEngineFactory factory = new FakeEngineFactory(0);
        supervisor(factory, 0).start();
        await().atMost(2, TimeUnit.SECONDS).until(supervisor::isRegistered);

        supervisor.shutdown();

        assertThat(supervisor.awaitTermination(Duration.ofSeconds(2))).isTrue();
        assertThat(factory.engines.get(0).shutdowns.get()).isEqualTo(1);
        assertThat(supervisor.isRegistered()).isFalse();
    }

    @Test
    void shouldKeepRetryingWhenRetryDelayIsNegative() {
        FakeEngineFactory factory = new FakeEngineFactory(2);
        supervisor = new RegistrationSupervisor(factory, null, IDENTITY, Duration.ofSeconds(-5), 0,
                                                Duration.ofMillis(50), Duration.ofMillis(10));
        supervisor.start();

        await().atMost(2, TimeUnit.SECONDS).until(supervisor::isRegistered);

        assertThat(supervisor.getAttemptCount()).isEqualTo(3);
    }

    @Test
    void shouldBuildAddressOfRecordFromExtensionAndServer() {
        assertThat(IDENTITY.getAddressOfRecord()).isEqualTo("sip:1001@pbx.local");
        assertThat(IDENTITY.toString()).contains("sip:1001@pbx.local:5060");
    }
}
