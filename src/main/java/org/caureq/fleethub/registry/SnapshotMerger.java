package org.caureq.fleethub.registry;

import org.caureq.fleethub.model.DiskStats;
import org.caureq.fleethub.model.GpuStats;
import org.caureq.fleethub.model.MetricSnapshot;
import org.caureq.fleethub.model.NetworkStats;
import org.caureq.fleethub.model.NpuStats;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Pure merge functions for partial updates. Disks match on device (or mount point),
 * interfaces on name, accelerators on index; unmatched entries are appended.
 */
final class SnapshotMerger {

    private SnapshotMerger() {}

    static MetricSnapshot realtime(MetricSnapshot cur, RealtimeUpdate rt, Instant at) {
        var cpu = cur.cpu()
                .withUsagePercent(rt.cpuUsage())
                .withTemperature(rt.cpuTemp())
                .withFrequencyMhz(rt.cpuFrequency());
        if (!rt.cpuPerCore().isEmpty()) cpu = cpu.withPerCoreUsage(rt.cpuPerCore());

        var mem = cur.memory()
                .withUsed(rt.memoryUsed())
                .withCached(rt.memoryCached())
                .withSwapUsed(rt.swapUsed());

        List<DiskStats> disks = new ArrayList<>(cur.disks());
        for (var io : rt.diskIo()) {
            int i = indexOf(disks, d -> Objects.equals(d.device(), io.device()));
            if (i >= 0) {
                disks.set(i, disks.get(i).withReadBytesPerSec(io.readBytesPerSec()).withWriteBytesPerSec(io.writeBytesPerSec()));
            } else {
                disks.add(io);
            }
        }

        List<NetworkStats> nets = new ArrayList<>(cur.networks());
        for (var io : rt.networkIo()) {
            int i = indexOf(nets, n -> Objects.equals(n.iface(), io.iface()));
            if (i >= 0) {
                nets.set(i, nets.get(i).withRxBytesPerSec(io.rxBytesPerSec()).withTxBytesPerSec(io.txBytesPerSec()).withUp(io.up()));
            } else {
                nets.add(io);
            }
        }

        List<GpuStats> gpus = new ArrayList<>(cur.gpus());
        for (var g : rt.gpus()) {
            int i = indexOf(gpus, x -> x.index() == g.index());
            if (i >= 0) {
                gpus.set(i, gpus.get(i).withUsagePercent(g.usagePercent()).withMemoryUsed(g.memoryUsed())
                        .withTemperature(g.temperature()).withPowerWatts(g.powerWatts()));
            } else {
                gpus.add(g);
            }
        }

        List<NpuStats> npus = new ArrayList<>(cur.npus());
        for (var n : rt.npus()) {
            int i = indexOf(npus, x -> x.index() == n.index());
            if (i >= 0) {
                npus.set(i, npus.get(i).withUsagePercent(n.usagePercent()).withMemoryUsed(n.memoryUsed())
                        .withTemperature(n.temperature()));
            } else {
                npus.add(n);
            }
        }

        return cur.toBuilder()
                .timestamp(at)
                .cpu(cpu)
                .memory(mem)
                .disks(disks)
                .networks(nets)
                .gpus(gpus)
                .npus(npus)
                .loadAverage(rt.loadAverage().isEmpty() ? cur.loadAverage() : rt.loadAverage())
                .build();
    }

    static MetricSnapshot staticInfo(MetricSnapshot cur, StaticUpdate st) {
        var b = cur.toBuilder();
        if (st.cpu() != null) {
            b.cpu(cur.cpu()
                    .withModel(st.cpu().model())
                    .withVendor(st.cpu().vendor())
                    .withCoreCount(st.cpu().coreCount())
                    .withLogicalCores(st.cpu().logicalCores())
                    .withArchitecture(st.cpu().architecture())
                    .withFrequencyMaxMhz(st.cpu().frequencyMaxMhz()));
        }
        if (st.memory() != null) {
            b.memory(cur.memory()
                    .withTotal(st.memory().total())
                    .withSwapTotal(st.memory().swapTotal())
                    .withMemoryType(st.memory().memoryType()));
        }

        List<DiskStats> disks = new ArrayList<>(cur.disks());
        for (var d : st.disks()) {
            int i = indexOf(disks, x -> x.sameDisk(d));
            if (i >= 0) {
                var merged = disks.get(i).withModel(d.model()).withDiskType(d.diskType()).withFsType(d.fsType());
                if (d.total() > 0) merged = merged.withTotal(d.total());
                disks.set(i, merged);
            } else {
                disks.add(d);
            }
        }
        b.disks(disks);

        List<NetworkStats> nets = new ArrayList<>(cur.networks());
        for (var n : st.networks()) {
            int i = indexOf(nets, x -> Objects.equals(x.iface(), n.iface()));
            if (i >= 0) {
                nets.set(i, nets.get(i).withMacAddress(n.macAddress()).withIpAddresses(n.ipAddresses()).withSpeedMbps(n.speedMbps()));
            } else {
                nets.add(n);
            }
        }
        b.networks(nets);

        List<GpuStats> gpus = new ArrayList<>(cur.gpus());
        for (var g : st.gpus()) {
            int i = indexOf(gpus, x -> x.index() == g.index());
            if (i >= 0) {
                gpus.set(i, gpus.get(i).withName(g.name()).withVendor(g.vendor()).withMemoryTotal(g.memoryTotal())
                        .withDriverVersion(g.driverVersion()));
            } else {
                gpus.add(g);
            }
        }
        b.gpus(gpus);

        List<NpuStats> npus = new ArrayList<>(cur.npus());
        for (var n : st.npus()) {
            int i = indexOf(npus, x -> x.index() == n.index());
            if (i >= 0) {
                npus.set(i, npus.get(i).withName(n.name()).withVendor(n.vendor()).withMemoryTotal(n.memoryTotal()));
            } else {
                npus.add(n);
            }
        }
        b.npus(npus);

        if (st.systemInfo() != null) b.systemInfo(st.systemInfo());
        return b.build();
    }

    static MetricSnapshot periodic(MetricSnapshot cur, PeriodicUpdate p) {
        List<DiskStats> disks = new ArrayList<>(cur.disks());
        for (var d : p.diskUsage()) {
            int i = indexOf(disks, x -> x.sameDisk(d));
            if (i >= 0) {
                var merged = disks.get(i).withUsed(d.used()).withAvailable(d.available()).withUsagePercent(d.usagePercent());
                if (d.total() > 0) merged = merged.withTotal(d.total());
                disks.set(i, merged);
            } else {
                disks.add(d);
            }
        }

        List<NetworkStats> nets = new ArrayList<>(cur.networks());
        for (var n : p.networkUpdates()) {
            int i = indexOf(nets, x -> Objects.equals(x.iface(), n.iface()));
            if (i < 0) continue; // addresses for an unknown interface are dropped
            var merged = nets.get(i).withUp(n.up());
            if (!n.ipAddresses().isEmpty()) merged = merged.withIpAddresses(n.ipAddresses());
            nets.set(i, merged);
        }

        var b = cur.toBuilder().disks(disks).networks(nets);
        if (!p.userSessions().isEmpty()) b.userSessions(p.userSessions());
        if (p.systemInfo() != null) b.systemInfo(p.systemInfo());
        return b.build();
    }

    private static <T> int indexOf(List<T> list, Predicate<T> match) {
        for (int i = 0; i < list.size(); i++) {
            if (match.test(list.get(i))) return i;
        }
        return -1;
    }
}
