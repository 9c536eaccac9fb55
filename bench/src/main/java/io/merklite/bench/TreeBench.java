// file: bench/src/main/java/io/merklite/bench/TreeBench.java
package io.merklite.bench;

import io.merklite.core.AuditPath;
import io.merklite.core.BytesContent;
import io.merklite.core.MerkleTree;
import io.merklite.core.hash.HashStrategies;
import io.merklite.core.hash.HashStrategy;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Microbenchmark for build, proof extraction and proof verification.
 *
 * Usage:
 *   java -jar bench.jar \
 *     --items 100000 \
 *     --item-bytes 256 \
 *     --threads 8 \
 *     --duration-seconds 30 \
 *     --hash sha-256
 *
 * Readers share one tree: each iteration picks a random item, extracts its
 * audit path and verifies it against the root. No rebuild runs concurrently.
 *
 * Output:
 *   - Summary line to stderr.
 *   - CSV to stdout with per-op latency samples:
 *       op,success,latency_us
 */
public final class TreeBench {
    private static final Logger log = Logger.getLogger(TreeBench.class.getName());

    private record Sample(boolean ok, double latencyMicros) {}

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        int items = Integer.parseInt(cfg.getOrDefault("items", "100000"));
        int itemBytes = Integer.parseInt(cfg.getOrDefault("item-bytes", "256"));
        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        int durationSeconds = Integer.parseInt(cfg.getOrDefault("duration-seconds", "30"));
        HashStrategy hash = HashStrategies.forName(cfg.getOrDefault("hash", HashStrategies.SHA_256));

        runBenchmark(items, itemBytes, threads, durationSeconds, hash);
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    static List<BytesContent> randomItems(int count, int itemBytes, long seed) {
        Random rnd = new Random(seed);
        List<BytesContent> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte[] b = new byte[itemBytes];
            rnd.nextBytes(b);
            out.add(new BytesContent(b));
        }
        return out;
    }

    private static void runBenchmark(
            int itemCount,
            int itemBytes,
            int threads,
            int durationSeconds,
            HashStrategy hash
    ) throws Exception {
        List<BytesContent> items = randomItems(itemCount, itemBytes, 42L);

        long buildStart = System.nanoTime();
        MerkleTree<BytesContent> tree = MerkleTree.build(items, hash);
        double buildMillis = (System.nanoTime() - buildStart) / 1_000_000.0;

        long verifyStart = System.nanoTime();
        boolean consistent = tree.verifyTree();
        double verifyMillis = (System.nanoTime() - verifyStart) / 1_000_000.0;
        if (!consistent) {
            throw new IllegalStateException("freshly built tree failed verification");
        }

        byte[] root = tree.root();
        ExecutorService exec = Executors.newFixedThreadPool(threads);
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
        AtomicLong opCount = new AtomicLong();
        long endTime = System.nanoTime() + TimeUnit.SECONDS.toNanos(durationSeconds);

        Runnable worker = () -> {
            ThreadLocalRandom rnd = ThreadLocalRandom.current();
            while (System.nanoTime() < endTime) {
                int index = rnd.nextInt(itemCount);
                long start = System.nanoTime();
                boolean ok = false;
                try {
                    // by index: a content scan would dominate the measurement
                    AuditPath path = tree.merklePath(index);
                    ok = path.verify(items.get(index), root, hash);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "proof for item " + index + " failed", e);
                } finally {
                    double latencyMicros = (System.nanoTime() - start) / 1_000.0;
                    samples.add(new Sample(ok, latencyMicros));
                    opCount.incrementAndGet();
                }
            }
        };

        for (int i = 0; i < threads; i++) {
            exec.submit(worker);
        }
        exec.shutdown();
        exec.awaitTermination(durationSeconds + 5L, TimeUnit.SECONDS);

        List<Sample> all = new ArrayList<>(samples.size());
        samples.drainTo(all);

        System.err.printf(
                "hash=%s, items=%d, height=%d, build=%.2fms, verifyTree=%.2fms%n",
                hash.name(), itemCount, tree.height(), buildMillis, verifyMillis
        );
        summarizeAndPrint(all, opCount.get(), durationSeconds);
    }

    private static void summarizeAndPrint(List<Sample> all, long totalOps, int durationSeconds) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        double throughput = totalOps / (double) durationSeconds;

        List<Double> latencies = new ArrayList<>(all.size());
        for (Sample s : all) {
            if (s.ok()) {
                latencies.add(s.latencyMicros());
            }
        }
        Collections.sort(latencies);

        long okCount = all.stream().filter(Sample::ok).count();
        long errCount = all.size() - okCount;

        System.err.printf(
                "proofs: throughput=%.2f ops/s, ok=%d, err=%d, p50=%.2fus, p95=%.2fus, p99=%.2fus%n",
                throughput, okCount, errCount,
                percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99)
        );

        System.out.println("op,success,latency_us");
        for (Sample s : all) {
            System.out.printf("prove+verify,%s,%.3f%n", s.ok() ? "1" : "0", s.latencyMicros());
        }
    }

    static double percentile(List<Double> sorted, double p) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int idx = (int) Math.ceil(p * sorted.size()) - 1;
        idx = Math.max(0, Math.min(idx, sorted.size() - 1));
        return sorted.get(idx);
    }
}
