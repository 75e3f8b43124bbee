package com.netsim.telemetry.shared.model.record;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;

/**
 * The identifying column block every table row starts with. Rows are joinable
 * across tables on {@code module_id} and timestamp proximity.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"timestamp", "module_id", "datacenter", "room", "rack",
        "device_hostname", "device_ip", "device_vendor", "interface", "speed"})
public class CommonFields {

    public static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = TIMESTAMP_PATTERN)
    private LocalDateTime timestamp;

    @JsonProperty("module_id")
    private String moduleId;

    @JsonProperty("datacenter")
    private String datacenter;

    @JsonProperty("room")
    private String room;

    @JsonProperty("rack")
    private String rack;

    @JsonProperty("device_hostname")
    private String deviceHostname;

    @JsonProperty("device_ip")
    private String deviceIp;

    @JsonProperty("device_vendor")
    private String deviceVendor;

    @JsonProperty("interface")
    private String interfaceName;

    @JsonProperty("speed")
    private String speed;

    public CommonFields() {}

    // --- Getters and Setters ---

    public LocalDateTime getTimestamp() { return timestamp; }
    public void setTimestamp(LocalDateTime timestamp) { this.timestamp = timestamp; }

    public String getModuleId() { return moduleId; }
    public void setModuleId(String moduleId) { this.moduleId = moduleId; }

    public String getDatacenter() { return datacenter; }
    public void setDatacenter(String datacenter) { this.datacenter = datacenter; }

    public String getRoom() { return room; }
    public void setRoom(String room) { this.room = room; }

    public String getRack() { return rack; }
    public void setRack(String rack) { this.rack = rack; }

    public String getDeviceHostname() { return deviceHostname; }
    public void setDeviceHostname(String deviceHostname) { this.deviceHostname = deviceHostname; }

    public String getDeviceIp() { return deviceIp; }
    public void setDeviceIp(String deviceIp) { this.deviceIp = deviceIp; }

    public String getDeviceVendor() { return deviceVendor; }
    public void setDeviceVendor(String deviceVendor) { this.deviceVendor = deviceVendor; }

    public String getInterfaceName() { return interfaceName; }
    public void setInterfaceName(String interfaceName) { this.interfaceName = interfaceName; }

    public String getSpeed() { return speed; }
    public void setSpeed(String speed) { this.speed = speed; }

    @Override
    public String toString() {
        return "CommonFields{moduleId='" + moduleId + "', timestamp=" + timestamp + "}";
    }
}
