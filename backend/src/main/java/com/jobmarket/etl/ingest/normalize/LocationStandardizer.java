package com.jobmarket.etl.ingest.normalize;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

@Component
public class LocationStandardizer {
    private static final Map<String, String> US_STATES = Map.ofEntries(
        entry("AL", "Alabama"), entry("AK", "Alaska"), entry("AZ", "Arizona"), entry("AR", "Arkansas"),
        entry("CA", "California"), entry("CO", "Colorado"), entry("CT", "Connecticut"), entry("DE", "Delaware"),
        entry("FL", "Florida"), entry("GA", "Georgia"), entry("HI", "Hawaii"), entry("ID", "Idaho"),
        entry("IL", "Illinois"), entry("IN", "Indiana"), entry("IA", "Iowa"), entry("KS", "Kansas"),
        entry("KY", "Kentucky"), entry("LA", "Louisiana"), entry("ME", "Maine"), entry("MD", "Maryland"),
        entry("MA", "Massachusetts"), entry("MI", "Michigan"), entry("MN", "Minnesota"), entry("MS", "Mississippi"),
        entry("MO", "Missouri"), entry("MT", "Montana"), entry("NE", "Nebraska"), entry("NV", "Nevada"),
        entry("NH", "New Hampshire"), entry("NJ", "New Jersey"), entry("NM", "New Mexico"), entry("NY", "New York"),
        entry("NC", "North Carolina"), entry("ND", "North Dakota"), entry("OH", "Ohio"), entry("OK", "Oklahoma"),
        entry("OR", "Oregon"), entry("PA", "Pennsylvania"), entry("RI", "Rhode Island"), entry("SC", "South Carolina"),
        entry("SD", "South Dakota"), entry("TN", "Tennessee"), entry("TX", "Texas"), entry("UT", "Utah"),
        entry("VT", "Vermont"), entry("VA", "Virginia"), entry("WA", "Washington"), entry("WV", "West Virginia"),
        entry("WI", "Wisconsin"), entry("WY", "Wyoming"), entry("DC", "District of Columbia")
    );

    /** Expands two-letter US state codes; anything else is returned trimmed. */
    public String expandState(String state, String country) {
        if (state == null || state.isBlank()) {
            return null;
        }
        String trimmed = state.trim();
        if (country != null && !"US".equalsIgnoreCase(country.trim())) {
            return trimmed;
        }
        String full = US_STATES.get(trimmed.toUpperCase(Locale.ROOT));
        return full == null ? trimmed : full;
    }

    public String standardize(String city, String state) {
        boolean hasCity = city != null && !city.isBlank();
        boolean hasState = state != null && !state.isBlank();
        if (hasCity && hasState) {
            return city.trim() + ", " + state.trim();
        }
        if (hasCity) {
            return city.trim();
        }
        return hasState ? state.trim() : null;
    }
}
