package com.williamcallahan.cleanhtml.domain.cleaning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of cleaning switches governing which tags survive the sanitizing filter.
 *
 * @param images allow {@code img} with {@code src} and {@code alt}
 * @param italics allow {@code em} and {@code i}
 * @param links allow {@code a} with {@code href} and {@code target}
 * @param table allow {@code table}, {@code tr} and {@code td}
 * @param strip allow nothing at all, overriding every other switch
 */
public record CleaningOptions(boolean images, boolean italics, boolean links, boolean table, boolean strip) {

    /**
     * Returns the configuration with every switch off.
     *
     * @return default options
     */
    public static CleaningOptions defaults() {
        return new CleaningOptions(false, false, false, false, false);
    }

    public boolean isEnabled(CleaningOption option) {
        return switch (option) {
            case IMAGES -> images;
            case ITALICS -> italics;
            case LINKS -> links;
            case TABLE -> table;
            case STRIP -> strip;
        };
    }

    /**
     * Applies a map of option overrides on top of this configuration.
     *
     * <p>Every key is validated before anything is applied, so a rejected map leaves no
     * partial change behind.
     *
     * @param overrides option values keyed by option name
     * @return new options with the overrides applied
     * @throws InvalidCleaningOptionException naming the first unknown key or null value
     */
    public CleaningOptions withOverrides(Map<String, Boolean> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        EnumMap<CleaningOption, Boolean> resolved = new EnumMap<>(CleaningOption.class);
        for (Map.Entry<String, Boolean> entry : overrides.entrySet()) {
            CleaningOption option = CleaningOption.fromKey(entry.getKey())
                    .orElseThrow(() -> new InvalidCleaningOptionException(
                            entry.getKey(), entry.getKey() + " does not exist as a settable option."));
            if (entry.getValue() == null) {
                throw new InvalidCleaningOptionException(
                        entry.getKey(), entry.getKey() + " requires a true or false value.");
            }
            resolved.put(option, entry.getValue());
        }

        EnumMap<CleaningOption, Boolean> merged = new EnumMap<>(CleaningOption.class);
        for (CleaningOption option : CleaningOption.values()) {
            merged.put(option, isEnabled(option));
        }
        merged.putAll(resolved);
        return new CleaningOptions(
                merged.get(CleaningOption.IMAGES),
                merged.get(CleaningOption.ITALICS),
                merged.get(CleaningOption.LINKS),
                merged.get(CleaningOption.TABLE),
                merged.get(CleaningOption.STRIP));
    }

    /**
     * Returns the options as a name to value map.
     *
     * @return unmodifiable map in declaration order of {@link CleaningOption}
     */
    public Map<String, Boolean> asMap() {
        Map<String, Boolean> snapshot = new LinkedHashMap<>();
        for (CleaningOption option : CleaningOption.values()) {
            snapshot.put(option.key(), isEnabled(option));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Derives the allowlist for the sanitizing filter.
     *
     * @return baseline tags plus the tags of every enabled switch, or nothing when stripping
     */
    public AllowedTags allowedTags() {
        if (strip) {
            return AllowedTags.none();
        }
        List<TagRule> rules = new ArrayList<>(AllowedTags.BASELINE);
        for (CleaningOption option : CleaningOption.values()) {
            if (isEnabled(option)) {
                rules.addAll(option.addedTags());
            }
        }
        return new AllowedTags(rules);
    }
}
