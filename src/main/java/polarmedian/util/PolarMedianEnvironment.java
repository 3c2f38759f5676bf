package polarmedian.util;

import ij.Prefs;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;

public class PolarMedianEnvironment {

    static int numThreads = Prefs.getThreads();
    static ExecutorService filterExecutor = new ForkJoinPool(numThreads);

    public static synchronized void setNumThreads(int numThreads) {
        if (numThreads < 1)
            throw new IllegalArgumentException("At least one thread is required");

        filterExecutor.shutdown();

        PolarMedianEnvironment.numThreads = numThreads;
        filterExecutor = new ForkJoinPool(numThreads);
    }

    public static synchronized ExecutorService getFilterExecutor() {
        return filterExecutor;
    }

    public static synchronized int getNumThreads() {
        return numThreads;
    }

}
