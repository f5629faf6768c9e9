package com.bko.intervalcoach.integrations.intervals;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One wellness record; {@code id} is the ISO date of the day.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntervalsWellness {
    private String id;
    private Double ctl;
    private Double atl;
    private Double hrv;
    private Integer restingHR;
    private Integer sleepSecs;
    private Integer sleepScore;
    private Integer readiness;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public Double getCtl() { return ctl; }
    public void setCtl(Double ctl) { this.ctl = ctl; }
    public Double getAtl() { return atl; }
    public void setAtl(Double atl) { this.atl = atl; }
    public Double getHrv() { return hrv; }
    public void setHrv(Double hrv) { this.hrv = hrv; }
    public Integer getRestingHR() { return restingHR; }
    public void setRestingHR(Integer restingHR) { this.restingHR = restingHR; }
    public Integer getSleepSecs() { return sleepSecs; }
    public void setSleepSecs(Integer sleepSecs) { this.sleepSecs = sleepSecs; }
    public Integer getSleepScore() { return sleepScore; }
    public void setSleepScore(Integer sleepScore) { this.sleepScore = sleepScore; }
    public Integer getReadiness() { return readiness; }
    public void setReadiness(Integer readiness) { this.readiness = readiness; }
}
