package com.bioterminal.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** run() 호출 옵션. limit 0 이하 = 제한 없음. */
public final class RunOptions {

    public static final int DEFAULT_BATCH_SIZE = 10;

    private DiscoveryMethod method = DiscoveryMethod.RSS;
    private Instant since;
    private int limit;
    private List<String> urls = List.of();
    private boolean dryRun;
    private boolean saveFixture;
    private int batchSize = DEFAULT_BATCH_SIZE;

    public static RunOptions defaults() { return new RunOptions(); }

    /** 명시 URL 모드 */
    public static RunOptions forUrls(List<String> urls) {
        return new RunOptions().setMethod(DiscoveryMethod.URL).setUrls(urls);
    }

    public DiscoveryMethod getMethod() { return method; }
    public RunOptions setMethod(DiscoveryMethod v) { this.method = (v == null) ? DiscoveryMethod.RSS : v; return this; }

    public Instant getSince() { return since; }
    public RunOptions setSince(Instant v) { this.since = v; return this; }

    public int getLimit() { return limit; }
    public RunOptions setLimit(int v) { this.limit = Math.max(0, v); return this; }

    public List<String> getUrls() { return urls; }
    public RunOptions setUrls(List<String> v) { this.urls = (v == null) ? List.of() : List.copyOf(new ArrayList<>(v)); return this; }

    public boolean isDryRun() { return dryRun; }
    public RunOptions setDryRun(boolean v) { this.dryRun = v; return this; }

    public boolean isSaveFixture() { return saveFixture; }
    public RunOptions setSaveFixture(boolean v) { this.saveFixture = v; return this; }

    public int getBatchSize() { return batchSize; }
    public RunOptions setBatchSize(int v) { this.batchSize = v; return this; }

    public void validate() {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        if (method == DiscoveryMethod.URL && urls.isEmpty()) {
            throw new IllegalArgumentException("url discovery requires at least one url");
        }
    }

    @Override public String toString() {
        return "RunOptions{method=" + method + ", since=" + since + ", limit=" + limit
                + ", urls=" + urls.size() + ", dryRun=" + dryRun + ", saveFixture=" + saveFixture
                + ", batchSize=" + batchSize + "}";
    }
}
