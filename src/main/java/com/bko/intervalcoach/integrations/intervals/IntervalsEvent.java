package com.bko.intervalcoach.integrations.intervals;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Calendar entry; goal events carry the categories RACE_A, RACE_B or RACE_C.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntervalsEvent {
    private Long id;
    private String category;
    private String name;
    private String description;
    @JsonProperty("start_date_local")
    private String startDateLocal;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getStartDateLocal() { return startDateLocal; }
    public void setStartDateLocal(String startDateLocal) { this.startDateLocal = startDateLocal; }
}
