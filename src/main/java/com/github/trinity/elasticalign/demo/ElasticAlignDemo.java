package com.github.trinity.elasticalign.demo;

import com.github.trinity.elasticalign.AlignmentConfig;
import com.github.trinity.elasticalign.AlignmentResult;
import com.github.trinity.elasticalign.ElasticAlign;

/**
 * Aligns a random bump family and prints the variance decomposition.
 * <p>
 * Arguments (all optional): method name ({@code mean} or {@code median}), lambda,
 * number of functions, number of samples.
 * </p>
 *
 * @author trinity-xai
 */
public class ElasticAlignDemo {

    public static void main(String[] args) {
        String method = args.length > 0 ? args[0] : "mean";
        double lambda = args.length > 1 ? Double.parseDouble(args[1]) : 0.0;
        int numFunctions = args.length > 2 ? Integer.parseInt(args[2]) : 20;
        int numSamples = args.length > 3 ? Integer.parseInt(args[3]) : 101;

        double[] time = SimulatedData.uniformGrid(numSamples, 0.0, 1.0);
        double[][] f = SimulatedData.randomBumps(time, numFunctions, 0.1, 0.1, 42L);

        AlignmentConfig config = new AlignmentConfig(lambda, method, 20);
        config.parallel = true;

        System.out.println("Aligning " + numFunctions + " functions (" + config + ")...");
        long startTime = System.nanoTime();
        AlignmentResult out = ElasticAlign.timeWarping(f, time, config);
        long elapsed = (System.nanoTime() - startTime) / 1_000_000;

        System.out.println("Finished in " + elapsed + " ms after " + out.getRounds()
            + " rounds (" + out.state + ")");
        System.out.println(out.variance);
    }
}
