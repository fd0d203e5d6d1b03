package com.shellysvn.core.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ShellyPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new ShellyProperties();
        assertEquals("svn", props.getExecutable());
        assertEquals(100, props.getLogLimit());
        assertEquals(0, props.getConnectionTimeoutSeconds());
        assertTrue(props.isSslVerify());
        assertFalse(props.getProxy().isEnabled());
    }

    @Test
    void defaultContextHasNoDeadlineOrProxy() {
        var context = new ShellyProperties().toExecutionContext();
        assertFalse(context.hasDeadline());
        assertFalse(context.proxy().isUsable());
        assertTrue(context.sslVerify());
    }

    @Test
    void executionContextFromSettings() {
        var props = new ShellyProperties();
        props.getSvn().setConnectionTimeoutSeconds(30);
        props.getSvn().setSslVerify(false);
        props.getProxy().setEnabled(true);
        props.getProxy().setHost("proxy.example.com");
        props.getProxy().setPort(3128);
        props.getProxy().setUsername("dev");

        var context = props.toExecutionContext();

        assertEquals(Duration.ofSeconds(30), context.connectionTimeout());
        assertFalse(context.sslVerify());
        assertTrue(context.proxy().isUsable());
        assertEquals("proxy.example.com", context.proxy().host());
        assertEquals("dev", context.proxy().username());
    }

    @Test
    void negativeTimeoutMeansNone() {
        var props = new ShellyProperties();
        props.getSvn().setConnectionTimeoutSeconds(-5);
        assertFalse(props.toExecutionContext().hasDeadline());
    }

    @Test
    void bindsKebabCaseKeys() {
        var source = new MapConfigurationPropertySource(Map.of(
                "shelly.svn.executable", "/usr/local/bin/svn",
                "shelly.svn.log-limit", "25",
                "shelly.svn.ssl-verify", "false",
                "shelly.proxy.enabled", "true",
                "shelly.proxy.host", "proxy",
                "shelly.proxy.port", "8080",
                "shelly.proxy.bypass-for-local", "true"));

        var props = new Binder(source).bind("shelly", ShellyProperties.class).get();

        assertEquals("/usr/local/bin/svn", props.getExecutable());
        assertEquals(25, props.getLogLimit());
        assertFalse(props.isSslVerify());
        assertTrue(props.getProxy().isBypassForLocal());
        assertTrue(props.toExecutionContext().proxy().isUsable());
    }
}
