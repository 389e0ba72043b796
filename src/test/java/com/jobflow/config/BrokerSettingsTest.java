package com.jobflow.config;

import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BrokerSettingsTest {

    private final Map<String, String> env = new HashMap<>();

    @Test
    public void testMissingUrlIsFatal() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> BrokerSettings.from(env::get));
        assertTrue(e.getMessage().contains(BrokerSettings.BROKER_URL));

        env.put(BrokerSettings.BROKER_URL, "   ");
        assertThrows(IllegalStateException.class, () -> BrokerSettings.from(env::get));
    }

    @Test
    public void testDefaults() {
        env.put(BrokerSettings.BROKER_URL, "jdbc:h2:mem:broker");

        BrokerSettings settings = BrokerSettings.from(env::get);

        assertEquals("jdbc:h2:mem:broker", settings.getUrl());
        assertEquals("sa", settings.getUser());
        assertEquals("", settings.getPassword());
        assertEquals("jdbc:h2:mem:broker", settings.getDataUrl(), "Data store defaults to the broker database");
        assertFalse(settings.isDevelopment());
        assertEquals(Duration.ofSeconds(30), settings.getConnectTimeout());
        assertEquals(Duration.ofSeconds(60), settings.getCommandTimeout());
    }

    @Test
    public void testDevelopmentTimeouts() {
        env.put(BrokerSettings.BROKER_URL, "jdbc:h2:mem:broker");
        env.put(BrokerSettings.DATA_URL, "jdbc:h2:mem:data");
        env.put(BrokerSettings.ENVIRONMENT, "development");
        env.put(BrokerSettings.BROKER_PASSWORD, "secret");

        BrokerSettings settings = BrokerSettings.from(env::get);

        assertEquals("jdbc:h2:mem:data", settings.getDataUrl());
        assertTrue(settings.isDevelopment());
        assertEquals(Duration.ofSeconds(5), settings.getConnectTimeout());
        assertEquals(Duration.ofSeconds(10), settings.getCommandTimeout());
        assertFalse(settings.toString().contains("secret"), "Password must not be printed");
    }
}
