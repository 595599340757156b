package com.alterante.nearby.coordinator;

import com.alterante.nearby.engine.Visibility;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Settings the engine is started with.
 *
 * @param deviceName       name advertised to other devices
 * @param visibility       whether this device can be discovered
 * @param downloadDir      where received files are written
 * @param staticPort       fixed service port, empty for an ephemeral one
 * @param consentTimeout   how long an inbound request waits before it is declined
 * @param discoveryOnStart start endpoint discovery as soon as the engine is up
 */
public record CoordinatorConfig(
        String deviceName,
        Visibility visibility,
        Path downloadDir,
        OptionalInt staticPort,
        Duration consentTimeout,
        boolean discoveryOnStart) {

    public static final Duration DEFAULT_CONSENT_TIMEOUT = Duration.ofMinutes(1);

    public CoordinatorConfig {
        Objects.requireNonNull(deviceName, "deviceName");
        Objects.requireNonNull(visibility, "visibility");
        Objects.requireNonNull(downloadDir, "downloadDir");
        Objects.requireNonNull(staticPort, "staticPort");
        Objects.requireNonNull(consentTimeout, "consentTimeout");
        if (consentTimeout.isNegative() || consentTimeout.isZero()) {
            throw new IllegalArgumentException("consentTimeout must be positive");
        }
        staticPort.ifPresent(p -> {
            if (p < 1 || p > 65535) throw new IllegalArgumentException("staticPort out of range: " + p);
        });
    }

    public static CoordinatorConfig defaults(String deviceName, Path downloadDir) {
        return new CoordinatorConfig(deviceName, Visibility.VISIBLE, downloadDir,
                OptionalInt.empty(), DEFAULT_CONSENT_TIMEOUT, false);
    }

    public CoordinatorConfig withVisibility(Visibility v) {
        return new CoordinatorConfig(deviceName, v, downloadDir, staticPort, consentTimeout, discoveryOnStart);
    }

    public CoordinatorConfig withDeviceName(String name) {
        return new CoordinatorConfig(name, visibility, downloadDir, staticPort, consentTimeout, discoveryOnStart);
    }

    public CoordinatorConfig withDownloadDir(Path dir) {
        return new CoordinatorConfig(deviceName, visibility, dir, staticPort, consentTimeout, discoveryOnStart);
    }

    public CoordinatorConfig withStaticPort(OptionalInt port) {
        return new CoordinatorConfig(deviceName, visibility, downloadDir, port, consentTimeout, discoveryOnStart);
    }

    public CoordinatorConfig withConsentTimeout(Duration timeout) {
        return new CoordinatorConfig(deviceName, visibility, downloadDir, staticPort, timeout, discoveryOnStart);
    }

    public CoordinatorConfig withDiscoveryOnStart(boolean on) {
        return new CoordinatorConfig(deviceName, visibility, downloadDir, staticPort, consentTimeout, on);
    }

    /** True if switching to {@code other} needs an engine restart. */
    public boolean requiresRestart(CoordinatorConfig other) {
        return !deviceName.equals(other.deviceName)
                || !downloadDir.equals(other.downloadDir)
                || !staticPort.equals(other.staticPort)
                || !consentTimeout.equals(other.consentTimeout);
    }
}
