package edu.ucca.datagen;

import edu.stanford.nlp.util.PropertiesUtils;
import edu.ucca.core.Passage;
import edu.ucca.parser.Derivation;
import edu.ucca.parser.OracleConfig;
import edu.ucca.parser.OracleError;
import edu.ucca.parser.OracleException;
import edu.ucca.parser.TransitionRunner;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static edu.stanford.nlp.util.logging.Redwood.Util.*;

/**
 * Extracts gold derivations for a whole corpus. Passages are independent, so each one gets its own
 * parser state and oracle on a pool of worker threads. A passage the oracle can't derive is logged
 * and reported in the result; the rest of the corpus goes on.
 */
public class CorpusOracleRunner {
    public static final String THREADS = "corpus.threads";

    private final OracleConfig config;
    private final int numThreads;

    public CorpusOracleRunner(OracleConfig config, int numThreads) {
        this.config = config;
        this.numThreads = numThreads > 0 ? numThreads : Runtime.getRuntime().availableProcessors();
    }

    public static CorpusOracleRunner fromProperties(Properties props) {
        return new CorpusOracleRunner(OracleConfig.fromProperties(props), PropertiesUtils.getInt(props, THREADS, 0));
    }

    public CorpusResult run(List<Passage> passages) {
        forceTrack("Extracting gold derivations for " + passages.size() + " passages");
        ExecutorService threadPool = Executors.newFixedThreadPool(numThreads);
        try {
            List<Future<Derivation>> futures = new ArrayList<>();
            for (Passage passage : passages) {
                futures.add(threadPool.submit(() -> TransitionRunner.extract(passage, config)));
            }

            CorpusResult result = new CorpusResult();
            for (int i = 0; i < passages.size(); i++) {
                Passage passage = passages.get(i);
                try {
                    result.addDerivation(passage, futures.get(i).get());
                }
                catch (ExecutionException e) {
                    if (!(e.getCause() instanceof OracleException)) {
                        throw new IllegalStateException("Failed extracting passage " + passage.getId(), e.getCause());
                    }
                    OracleError error = ((OracleException) e.getCause()).getError();
                    warn("Skipping passage " + passage.getId() + ": " + error.getReason());
                    result.addFailure(passage, error);
                }
            }

            log("Derived " + result.getDerivations().size() + " passages, skipped " + result.getFailures().size());
            log("Action counts: " + result.actionCounts());
            return result;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while extracting derivations", e);
        }
        finally {
            threadPool.shutdownNow();
            endTrack("Extracting gold derivations for " + passages.size() + " passages");
        }
    }

    public OracleConfig getConfig() {
        return config;
    }

    public int getNumThreads() {
        return numThreads;
    }
}
