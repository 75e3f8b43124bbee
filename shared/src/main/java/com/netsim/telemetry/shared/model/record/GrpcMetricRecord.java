package com.netsim.telemetry.shared.model.record;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One gNMI interface sample: per-minute counters and gauges plus the optical
 * readings streamed alongside them. Optical columns are null for interfaces
 * without a module.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GrpcMetricRecord extends TelemetryRecord {

    @JsonProperty("subscription_path")
    private String subscriptionPath;

    @JsonProperty("encoding")
    private String encoding;

    @JsonProperty("sample_interval_sec")
    private int sampleIntervalSec;

    @JsonProperty("admin_status")
    private String adminStatus;

    @JsonProperty("oper_status")
    private String operStatus;

    @JsonProperty("in_octets")
    private long inOctets;

    @JsonProperty("out_octets")
    private long outOctets;

    @JsonProperty("in_pkts")
    private long inPkts;

    @JsonProperty("out_pkts")
    private long outPkts;

    @JsonProperty("in_errors")
    private long inErrors;

    @JsonProperty("out_errors")
    private long outErrors;

    @JsonProperty("in_discards")
    private long inDiscards;

    @JsonProperty("out_discards")
    private long outDiscards;

    @JsonProperty("in_crc_errors")
    private long inCrcErrors;

    @JsonProperty("congestion_drops")
    private long congestionDrops;

    @JsonProperty("carrier_transitions")
    private int carrierTransitions;

    @JsonProperty("in_utilization")
    private double inUtilization;

    @JsonProperty("out_utilization")
    private double outUtilization;

    // Embedded optics
    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("voltage")
    private Double voltage;

    @JsonProperty("bias_current")
    private Double biasCurrent;

    @JsonProperty("tx_power")
    private Double txPower;

    @JsonProperty("rx_power")
    private Double rxPower;

    public GrpcMetricRecord() {}

    @Override
    public TableType getTableType() {
        return TableType.GRPC;
    }

    // --- Getters and Setters ---

    public String getSubscriptionPath() { return subscriptionPath; }
    public void setSubscriptionPath(String subscriptionPath) { this.subscriptionPath = subscriptionPath; }

    public String getEncoding() { return encoding; }
    public void setEncoding(String encoding) { this.encoding = encoding; }

    public int getSampleIntervalSec() { return sampleIntervalSec; }
    public void setSampleIntervalSec(int sampleIntervalSec) { this.sampleIntervalSec = sampleIntervalSec; }

    public String getAdminStatus() { return adminStatus; }
    public void setAdminStatus(String adminStatus) { this.adminStatus = adminStatus; }

    public String getOperStatus() { return operStatus; }
    public void setOperStatus(String operStatus) { this.operStatus = operStatus; }

    public long getInOctets() { return inOctets; }
    public void setInOctets(long inOctets) { this.inOctets = inOctets; }

    public long getOutOctets() { return outOctets; }
    public void setOutOctets(long outOctets) { this.outOctets = outOctets; }

    public long getInPkts() { return inPkts; }
    public void setInPkts(long inPkts) { this.inPkts = inPkts; }

    public long getOutPkts() { return outPkts; }
    public void setOutPkts(long outPkts) { this.outPkts = outPkts; }

    public long getInErrors() { return inErrors; }
    public void setInErrors(long inErrors) { this.inErrors = inErrors; }

    public long getOutErrors() { return outErrors; }
    public void setOutErrors(long outErrors) { this.outErrors = outErrors; }

    public long getInDiscards() { return inDiscards; }
    public void setInDiscards(long inDiscards) { this.inDiscards = inDiscards; }

    public long getOutDiscards() { return outDiscards; }
    public void setOutDiscards(long outDiscards) { this.outDiscards = outDiscards; }

    public long getInCrcErrors() { return inCrcErrors; }
    public void setInCrcErrors(long inCrcErrors) { this.inCrcErrors = inCrcErrors; }

    public long getCongestionDrops() { return congestionDrops; }
    public void setCongestionDrops(long congestionDrops) { this.congestionDrops = congestionDrops; }

    public int getCarrierTransitions() { return carrierTransitions; }
    public void setCarrierTransitions(int carrierTransitions) { this.carrierTransitions = carrierTransitions; }

    public double getInUtilization() { return inUtilization; }
    public void setInUtilization(double inUtilization) { this.inUtilization = inUtilization; }

    public double getOutUtilization() { return outUtilization; }
    public void setOutUtilization(double outUtilization) { this.outUtilization = outUtilization; }

    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }

    public Double getVoltage() { return voltage; }
    public void setVoltage(Double voltage) { this.voltage = voltage; }

    public Double getBiasCurrent() { return biasCurrent; }
    public void setBiasCurrent(Double biasCurrent) { this.biasCurrent = biasCurrent; }

    public Double getTxPower() { return txPower; }
    public void setTxPower(Double txPower) { this.txPower = txPower; }

    public Double getRxPower() { return rxPower; }
    public void setRxPower(Double rxPower) { this.rxPower = rxPower; }
}
