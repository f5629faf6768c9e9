package com.bko.intervalcoach.integrations.intervals;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class IntervalsActivity {
    private String id;
    private String name;
    private String type;
    @JsonProperty("start_date_local")
    private String startDateLocal;
    @JsonProperty("moving_time")
    private Integer movingTime;
    @JsonProperty("icu_training_load")
    private Double icuTrainingLoad;
    @JsonProperty("icu_intensity")
    private Double icuIntensity;
    @JsonProperty("icu_zone_times")
    private List<ZoneTime> icuZoneTimes;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getStartDateLocal() { return startDateLocal; }
    public void setStartDateLocal(String startDateLocal) { this.startDateLocal = startDateLocal; }
    public Integer getMovingTime() { return movingTime; }
    public void setMovingTime(Integer movingTime) { this.movingTime = movingTime; }
    public Double getIcuTrainingLoad() { return icuTrainingLoad; }
    public void setIcuTrainingLoad(Double icuTrainingLoad) { this.icuTrainingLoad = icuTrainingLoad; }
    public Double getIcuIntensity() { return icuIntensity; }
    public void setIcuIntensity(Double icuIntensity) { this.icuIntensity = icuIntensity; }
    public List<ZoneTime> getIcuZoneTimes() { return icuZoneTimes; }
    public void setIcuZoneTimes(List<ZoneTime> icuZoneTimes) { this.icuZoneTimes = icuZoneTimes; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ZoneTime {
        private String id;
        private Integer secs;

        public ZoneTime() {
        }

        public ZoneTime(String id, Integer secs) {
            this.id = id;
            this.secs = secs;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public Integer getSecs() { return secs; }
        public void setSecs(Integer secs) { this.secs = secs; }
    }
}
