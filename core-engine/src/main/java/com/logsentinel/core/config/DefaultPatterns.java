package com.logsentinel.core.config;

import com.logsentinel.core.model.AnomalyPattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in pattern catalogue for embedded device and kernel logs.
 *
 * <p>
 * Order matters: it is the registration order, so earlier rules win when a
 * line matches several of them.
 * </p>
 *
 * @since 1.0.0
 */
public final class DefaultPatterns {

    private static final Map<String, String> CATALOGUE;

    static {
        Map<String, String> m = new LinkedHashMap<>();

        // Kernel and system crashes
        m.put("Kernel panic", "KERNEL_PANIC");
        m.put("Crashdump magic", "CRASH_DUMP");
        m.put("Call Trace", "CALL_TRACE");
        m.put("Segmentation Fault|segfault", "SEGMENTATION_FAULT");
        m.put("Backtrace", "BACKTRACE");
        m.put("watchdog bite", "WATCHDOG_BITE");
        m.put("Oops", "OOPS_TRACE");

        // Memory
        m.put("page\\+allocation\\s+failure", "PAGE_ALLOCATION_FAILURE");
        m.put("Unable to handle kernel NULL pointer dereference", "MEMORY_CORRUPTION");
        m.put("Unable to handle kernel paging request", "MEMORY_CORRUPTION");
        m.put("Out of memory: Kill process", "OUT_OF_MEMORY");
        m.put("ERROR:NBUF alloc failed", "LOW_MEMORY");

        // Reboot loops
        m.put("Reboot Reason", "DEVICE_REBOOT");
        m.put("System restart", "DEVICE_REBOOT");

        // Interfaces
        m.put("Interface down", "INTERFACE_DOWN");
        m.put("Link is down", "INTERFACE_DOWN");
        m.put("carrier lost", "INTERFACE_DOWN");
        m.put("entered disabled state", "INTERFACE_DISABLED");

        // Authentication
        m.put("authentication failed", "AUTH_FAILURE");
        m.put("Authentication timeout", "AUTH_TIMEOUT");
        m.put("Invalid credentials", "AUTH_INVALID_CREDS");
        m.put("Access denied", "AUTH_ACCESS_DENIED");

        // Network
        m.put("Packet loss", "PACKET_LOSS");
        m.put("High latency", "HIGH_LATENCY");
        m.put("Connection timeout", "CONNECTION_TIMEOUT");
        m.put("No route to host", "NO_ROUTE");
        m.put("Network unreachable", "NETWORK_UNREACHABLE");

        // Configuration
        m.put("Configuration mismatch", "CONFIG_MISMATCH");
        m.put("Invalid configuration", "CONFIG_INVALID");
        m.put("Configuration error", "CONFIG_ERROR");

        // Wi-Fi
        m.put("vap_down", "VAP_DOWN");
        m.put("Received CSA", "CHANNEL_SWITCH");
        m.put("Invalid beacon report", "BEACON_REPORT_ISSUE");

        // Resources, RCU and timing
        m.put("Resource manager crash", "RESOURCE_MANAGER_CRASH");
        m.put("timeout waiting", "TIMEOUT");

        // Warnings
        m.put("CPU:\\d+ WARNING", "CPU_WARNING");

        CATALOGUE = Collections.unmodifiableMap(m);
    }

    private DefaultPatterns() {
        // utility class: not instantiable
    }

    /**
     * @return unmodifiable regex source → category, in registration order
     */
    public static Map<String, String> asMap() {
        return CATALOGUE;
    }

    /**
     * @return the catalogue as default-origin patterns, in registration order
     */
    public static List<AnomalyPattern> asPatterns() {
        List<AnomalyPattern> patterns = new ArrayList<>(CATALOGUE.size());
        CATALOGUE.forEach((source, category) -> patterns.add(AnomalyPattern.builtIn(source, category)));
        return Collections.unmodifiableList(patterns);
    }
}
