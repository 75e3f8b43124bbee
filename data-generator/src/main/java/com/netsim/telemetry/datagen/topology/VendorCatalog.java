package com.netsim.telemetry.datagen.topology;

import com.netsim.telemetry.shared.model.topology.LinkSpeed;

import java.util.List;
import java.util.Map;

/**
 * Static vendor knowledge the generators draw on: device and optic vendor
 * lists, SNMP enterprise OIDs, interface naming, gNMI encodings, counter
 * subscription paths and system descriptions.
 *
 * Unknown vendors fall back to SONiC-style conventions.
 */
public final class VendorCatalog {

    public static final List<String> DEVICE_VENDORS = List.of(
            "Cisco", "Huawei", "Juniper", "Arista", "Dell", "Broadcom Sonic", "Community Sonic");

    public static final List<String> OPTICAL_VENDORS = List.of(
            "Innolight", "Luxshare", "Finisar", "HGTECH", "Eoptolink", "Accelink");

    /** OpenConfig counters path; also the fallback for vendors without a native model. */
    public static final String OPENCONFIG_COUNTERS_PATH = "/interfaces/interface[name=%s]/state/counters";

    private static final Map<String, String> GNMI_COUNTERS_PATHS = Map.of(
            "Cisco", "Cisco-IOS-XR-infra-statsd-oper:infra-statistics/interfaces/interface[interface-name=%s]/latest/generic-counters",
            "Huawei", "huawei-ifm:ifm/interfaces/interface[name=%s]/mib-statistics",
            "Juniper", OPENCONFIG_COUNTERS_PATH,
            "Arista", "eos_native:/Sysdb/interface/counter/eth/phy/%s/current",
            "Dell", "dell-if:interfaces-state/interface[name=%s]/statistics",
            "Broadcom Sonic", "openconfig-interfaces:interfaces/interface[name=%s]/state/counters",
            "Community Sonic", "openconfig-interfaces:interfaces/interface[name=%s]/state/counters");

    private static final Map<String, String> ENTERPRISE_OIDS = Map.of(
            "Cisco", "1.3.6.1.4.1.9",
            "Huawei", "1.3.6.1.4.1.2011",
            "Juniper", "1.3.6.1.4.1.2636",
            "Arista", "1.3.6.1.4.1.30065",
            "Dell", "1.3.6.1.4.1.674",
            "Broadcom Sonic", "1.3.6.1.4.1.4413",
            "Community Sonic", "1.3.6.1.4.1.8072");

    private static final Map<String, String> OS_NAMES = Map.of(
            "Cisco", "Cisco NX-OS(tm) nxos.%s",
            "Huawei", "Huawei Versatile Routing Platform Software VRP (R) software, Version %s",
            "Juniper", "Juniper Networks, Inc. JUNOS %s",
            "Arista", "Arista Networks EOS version %s",
            "Dell", "Dell EMC Networking OS10 Enterprise %s",
            "Broadcom Sonic", "SONiC Software Version: SONiC.broadcom.%s",
            "Community Sonic", "SONiC Software Version: SONiC.community.%s");

    private VendorCatalog() {}

    public static String enterpriseOid(String vendor) {
        return ENTERPRISE_OIDS.getOrDefault(vendor, "1.3.6.1.4.1.8072");
    }

    public static String systemDescription(String vendor, String version) {
        return String.format(OS_NAMES.getOrDefault(vendor, "Network OS %s"), version);
    }

    /**
     * gNMI subscription path a vendor's collector uses for one interface's counters.
     */
    public static String gnmiCountersPath(String vendor, String interfaceName) {
        return String.format(GNMI_COUNTERS_PATHS.getOrDefault(vendor, OPENCONFIG_COUNTERS_PATH), interfaceName);
    }

    /**
     * gNMI payload encoding a vendor streams by default.
     */
    public static String gnmiEncoding(String vendor) {
        return switch (vendor) {
            case "Cisco", "Huawei", "Juniper" -> "PROTO";
            case "Arista" -> "JSON_IETF";
            default -> "JSON";
        };
    }

    /**
     * Vendor-style interface name for a front-panel port.
     */
    public static String interfaceName(String vendor, LinkSpeed speed, int port) {
        return switch (vendor) {
            case "Cisco" -> ciscoPrefix(speed) + "1/0/" + port;
            case "Juniper" -> juniperPrefix(speed) + "-0/0/" + (port - 1);
            case "Huawei" -> speed.getLabel().replace("G", "GE").replace("1GE", "GE") + "1/0/" + port;
            case "Arista" -> "Ethernet" + port + "/1";
            case "Dell" -> "ethernet1/1/" + port;
            default -> "Ethernet" + ((port - 1) * 4);
        };
    }

    private static String ciscoPrefix(LinkSpeed speed) {
        return switch (speed) {
            case G1 -> "GigabitEthernet";
            case G10 -> "TenGigabitEthernet";
            case G25 -> "TwentyFiveGigE";
            case G40 -> "FortyGigabitEthernet";
            case G100 -> "HundredGigE";
            case G200 -> "TwoHundredGigE";
            case G400 -> "FourHundredGigE";
            case G800 -> "EightHundredGigE";
        };
    }

    private static String juniperPrefix(LinkSpeed speed) {
        return switch (speed) {
            case G1 -> "ge";
            case G10 -> "xe";
            default -> "et";
        };
    }
}
