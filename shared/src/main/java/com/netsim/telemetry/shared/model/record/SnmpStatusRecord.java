package com.netsim.telemetry.shared.model.record;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One SNMP poll of an interface. Column names follow IF-MIB / IF-MIB HC
 * object names. HC counters are monotonic per interface over the run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SnmpStatusRecord extends TelemetryRecord {

    /** ifSpeed is a Gauge32; faster links report the max and use ifHighSpeed. */
    public static final long IF_SPEED_MAX = 4_294_967_295L;

    @JsonProperty("ifIndex")
    private int ifIndex;

    @JsonProperty("ifDescr")
    private String ifDescr;

    @JsonProperty("ifAlias")
    private String ifAlias;

    @JsonProperty("ifType")
    private int ifType;

    @JsonProperty("ifMtu")
    private int ifMtu;

    @JsonProperty("ifSpeed")
    private long ifSpeed;

    @JsonProperty("ifHighSpeed")
    private long ifHighSpeed;

    @JsonProperty("ifAdminStatus")
    private String ifAdminStatus;

    @JsonProperty("ifOperStatus")
    private String ifOperStatus;

    @JsonProperty("ifLastChange")
    private long ifLastChange;

    @JsonProperty("ifHCInOctets")
    private long ifHCInOctets;

    @JsonProperty("ifHCOutOctets")
    private long ifHCOutOctets;

    @JsonProperty("ifHCInUcastPkts")
    private long ifHCInUcastPkts;

    @JsonProperty("ifHCOutUcastPkts")
    private long ifHCOutUcastPkts;

    @JsonProperty("ifInErrors")
    private long ifInErrors;

    @JsonProperty("ifOutErrors")
    private long ifOutErrors;

    @JsonProperty("ifInDiscards")
    private long ifInDiscards;

    @JsonProperty("ifOutDiscards")
    private long ifOutDiscards;

    @JsonProperty("ifHCInBroadcastPkts")
    private long ifHCInBroadcastPkts;

    @JsonProperty("ifHCInMulticastPkts")
    private long ifHCInMulticastPkts;

    @JsonProperty("broadcastStorm")
    private boolean broadcastStorm;

    @JsonProperty("macTableSize")
    private int macTableSize;

    @JsonProperty("sysUpTime")
    private long sysUpTime;

    @JsonProperty("sysObjectID")
    private String sysObjectId;

    public SnmpStatusRecord() {}

    @Override
    public TableType getTableType() {
        return TableType.SNMP;
    }

    // --- Getters and Setters ---

    public int getIfIndex() { return ifIndex; }
    public void setIfIndex(int ifIndex) { this.ifIndex = ifIndex; }

    public String getIfDescr() { return ifDescr; }
    public void setIfDescr(String ifDescr) { this.ifDescr = ifDescr; }

    public String getIfAlias() { return ifAlias; }
    public void setIfAlias(String ifAlias) { this.ifAlias = ifAlias; }

    public int getIfType() { return ifType; }
    public void setIfType(int ifType) { this.ifType = ifType; }

    public int getIfMtu() { return ifMtu; }
    public void setIfMtu(int ifMtu) { this.ifMtu = ifMtu; }

    public long getIfSpeed() { return ifSpeed; }
    public void setIfSpeed(long ifSpeed) { this.ifSpeed = ifSpeed; }

    public long getIfHighSpeed() { return ifHighSpeed; }
    public void setIfHighSpeed(long ifHighSpeed) { this.ifHighSpeed = ifHighSpeed; }

    public String getIfAdminStatus() { return ifAdminStatus; }
    public void setIfAdminStatus(String ifAdminStatus) { this.ifAdminStatus = ifAdminStatus; }

    public String getIfOperStatus() { return ifOperStatus; }
    public void setIfOperStatus(String ifOperStatus) { this.ifOperStatus = ifOperStatus; }

    public long getIfLastChange() { return ifLastChange; }
    public void setIfLastChange(long ifLastChange) { this.ifLastChange = ifLastChange; }

    public long getIfHCInOctets() { return ifHCInOctets; }
    public void setIfHCInOctets(long ifHCInOctets) { this.ifHCInOctets = ifHCInOctets; }

    public long getIfHCOutOctets() { return ifHCOutOctets; }
    public void setIfHCOutOctets(long ifHCOutOctets) { this.ifHCOutOctets = ifHCOutOctets; }

    public long getIfHCInUcastPkts() { return ifHCInUcastPkts; }
    public void setIfHCInUcastPkts(long ifHCInUcastPkts) { this.ifHCInUcastPkts = ifHCInUcastPkts; }

    public long getIfHCOutUcastPkts() { return ifHCOutUcastPkts; }
    public void setIfHCOutUcastPkts(long ifHCOutUcastPkts) { this.ifHCOutUcastPkts = ifHCOutUcastPkts; }

    public long getIfInErrors() { return ifInErrors; }
    public void setIfInErrors(long ifInErrors) { this.ifInErrors = ifInErrors; }

    public long getIfOutErrors() { return ifOutErrors; }
    public void setIfOutErrors(long ifOutErrors) { this.ifOutErrors = ifOutErrors; }

    public long getIfInDiscards() { return ifInDiscards; }
    public void setIfInDiscards(long ifInDiscards) { this.ifInDiscards = ifInDiscards; }

    public long getIfOutDiscards() { return ifOutDiscards; }
    public void setIfOutDiscards(long ifOutDiscards) { this.ifOutDiscards = ifOutDiscards; }

    public long getIfHCInBroadcastPkts() { return ifHCInBroadcastPkts; }
    public void setIfHCInBroadcastPkts(long ifHCInBroadcastPkts) { this.ifHCInBroadcastPkts = ifHCInBroadcastPkts; }

    public long getIfHCInMulticastPkts() { return ifHCInMulticastPkts; }
    public void setIfHCInMulticastPkts(long ifHCInMulticastPkts) { this.ifHCInMulticastPkts = ifHCInMulticastPkts; }

    public boolean isBroadcastStorm() { return broadcastStorm; }
    public void setBroadcastStorm(boolean broadcastStorm) { this.broadcastStorm = broadcastStorm; }

    public int getMacTableSize() { return macTableSize; }
    public void setMacTableSize(int macTableSize) { this.macTableSize = macTableSize; }

    public long getSysUpTime() { return sysUpTime; }
    public void setSysUpTime(long sysUpTime) { this.sysUpTime = sysUpTime; }

    public String getSysObjectId() { return sysObjectId; }
    public void setSysObjectId(String sysObjectId) { this.sysObjectId = sysObjectId; }
}
