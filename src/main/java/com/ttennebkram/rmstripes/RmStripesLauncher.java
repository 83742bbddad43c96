package com.ttennebkram.rmstripes;

import com.ttennebkram.rmstripes.cli.RmStripesCli;

/**
 * Main class of the shaded jar.
 * Loads the OpenCV native library before any Mat is created.
 */
public class RmStripesLauncher {

    public static void main(String[] args) {
        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();

        System.exit(new RmStripesCli().run(args));
    }
}
