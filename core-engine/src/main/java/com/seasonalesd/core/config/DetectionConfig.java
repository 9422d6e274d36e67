package com.seasonalesd.core.config;

import com.seasonalesd.core.exception.InvalidConfigurationException;
import com.seasonalesd.core.model.DetectionProfile;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Detection profiles bound from YAML, addressable by name.
 *
 * <pre>
 * profiles:
 *   - name: daily_orders
 *     period: 7
 *     maxAnoms: 0.1
 *     alpha: 0.05
 *     direction: both
 * </pre>
 *
 * <p>
 * SnakeYAML fills the profile list through {@link #setProfiles(List)}; the
 * name index is rebuilt on every set. Lookups are only meaningful after
 * {@link #validate()} has passed, since a duplicate name shadows the later
 * profile.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<DetectionProfile> profiles = new ArrayList<>();
    private Map<String, DetectionProfile> byName = new LinkedHashMap<>();

    /**
     * @return unmodifiable profiles in file order
     */
    public List<DetectionProfile> getProfiles() {
        return Collections.unmodifiableList(profiles);
    }

    /**
     * Replace the profiles (used by SnakeYAML during deserialization).
     *
     * @param profiles the detection profiles; {@code null} clears them
     */
    public void setProfiles(List<DetectionProfile> profiles) {
        this.profiles = profiles != null ? new ArrayList<>(profiles) : new ArrayList<>();
        this.byName = new LinkedHashMap<>();
        for (DetectionProfile profile : this.profiles) {
            if (profile != null && profile.getName() != null) {
                byName.putIfAbsent(profile.getName(), profile);
            }
        }
    }

    /**
     * @return profile names in file order
     */
    public Set<String> getProfileNames() {
        return Collections.unmodifiableSet(byName.keySet());
    }

    /**
     * @param name profile name; must not be {@code null}
     * @return the profile, or empty if none has that name
     */
    public Optional<DetectionProfile> getProfile(String name) {
        Objects.requireNonNull(name, "Profile name must not be null");
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * @param name profile name; must not be {@code null}
     * @return the profile with that name
     * @throws InvalidConfigurationException if no profile has that name
     */
    public DetectionProfile requireProfile(String name) {
        return getProfile(name).orElseThrow(() -> new InvalidConfigurationException(
                "Unknown detection profile '" + name + "', known: " + byName.keySet()));
    }

    /**
     * Check every profile and the uniqueness of names.
     *
     * <p>
     * Problems are reported per list position, so an entry without a name
     * can still be located in the file.
     * </p>
     *
     * @throws IllegalStateException if any profile is invalid or a name
     *                               repeats
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Map<String, Integer> firstSeen = new LinkedHashMap<>();

        for (int i = 0; i < profiles.size(); i++) {
            DetectionProfile profile = profiles.get(i);
            if (profile == null) {
                errors.add("profiles[" + i + "]: empty entry");
                continue;
            }
            for (String problem : profile.problems()) {
                errors.add("profiles[" + i + "]: " + problem);
            }
            String name = profile.getName();
            if (name != null) {
                Integer previous = firstSeen.putIfAbsent(name, i);
                if (previous != null) {
                    errors.add("profiles[" + i + "]: Duplicate profile name: '" + name
                            + "' (first defined at profiles[" + previous + "])");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "DetectionConfig{profiles=" + byName.keySet() + '}';
    }
}
