package com.pizhai.render.health;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.pizhai.render.pool.PoolStatistics;

/**
 * 健康检查报告
 */
public final class HealthReport {

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private static final long MB = 1024 * 1024;

    private final HealthStatus status;
    private final long uptimeMillis;
    private final PoolStatistics pool;
    private final long heapUsed;
    private final long heapTotal;
    private final long nonHeapUsed;
    private final long timestamp;

    public HealthReport(HealthStatus status, long uptimeMillis, PoolStatistics pool,
                        long heapUsed, long heapTotal, long nonHeapUsed, long timestamp) {
        this.status = status;
        this.uptimeMillis = uptimeMillis;
        this.pool = pool;
        this.heapUsed = heapUsed;
        this.heapTotal = heapTotal;
        this.nonHeapUsed = nonHeapUsed;
        this.timestamp = timestamp;
    }

    public HealthStatus getStatus() {
        return status;
    }

    public long getUptimeMillis() {
        return uptimeMillis;
    }

    public PoolStatistics getPool() {
        return pool;
    }

    public long getHeapUsedMb() {
        return heapUsed / MB;
    }

    public long getHeapTotalMb() {
        return heapTotal / MB;
    }

    public long getNonHeapUsedMb() {
        return nonHeapUsed / MB;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public JsonObject toJsonObject() {
        JsonObject poolJson = new JsonObject();
        poolJson.addProperty("total", pool.getTotal());
        poolJson.addProperty("inUse", pool.getInUse());
        poolJson.addProperty("available", pool.getAvailable());
        poolJson.addProperty("waiting", pool.getWaiting());
        poolJson.addProperty("launching", pool.getLaunching());
        poolJson.addProperty("min", pool.getMinInstances());
        poolJson.addProperty("max", pool.getMaxInstances());
        poolJson.addProperty("created", pool.getCreated());

        JsonObject memory = new JsonObject();
        memory.addProperty("heapUsedMb", getHeapUsedMb());
        memory.addProperty("heapTotalMb", getHeapTotalMb());
        memory.addProperty("nonHeapUsedMb", getNonHeapUsedMb());

        JsonObject json = new JsonObject();
        json.addProperty("status", status.getValue());
        json.addProperty("uptime", uptimeMillis);
        json.add("browserPool", poolJson);
        json.add("memory", memory);
        json.addProperty("timestamp", timestamp);
        return json;
    }

    public String toJson() {
        return gson.toJson(toJsonObject());
    }

    @Override
    public String toString() {
        return String.format("HealthReport[status=%s, uptime=%dms, %s, heapUsed=%dMB]",
                status.getValue(), uptimeMillis, pool, getHeapUsedMb());
    }
}
