package com.bko.intervalcoach.integrations.intervals;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class IntervalsAthlete {
    private String id;
    @JsonProperty("icu_weight")
    private Double icuWeight;
    private List<SportSettings> sportSettings;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public Double getIcuWeight() { return icuWeight; }
    public void setIcuWeight(Double icuWeight) { this.icuWeight = icuWeight; }
    public List<SportSettings> getSportSettings() { return sportSettings; }
    public void setSportSettings(List<SportSettings> sportSettings) { this.sportSettings = sportSettings; }

    /**
     * Manually configured threshold of the first sport that declares one.
     */
    public Double manualFtp() {
        if (sportSettings == null) {
            return null;
        }
        return sportSettings.stream()
                .map(SportSettings::getFtp)
                .filter(ftp -> ftp != null && ftp > 0)
                .findFirst()
                .orElse(null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SportSettings {
        private List<String> types;
        private Double ftp;

        public List<String> getTypes() { return types; }
        public void setTypes(List<String> types) { this.types = types; }
        public Double getFtp() { return ftp; }
        public void setFtp(Double ftp) { this.ftp = ftp; }
    }
}
