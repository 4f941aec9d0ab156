package com.example.render_tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Constants for the elapsed-time progress heuristic.
 */
@ConfigurationProperties(prefix = "render.progress")
public class ProgressProperties {

    private TwoPhase gpu = new TwoPhase();
    private Linear serverless = new Linear(Duration.ofSeconds(50));
    private Linear local = new Linear(Duration.ofSeconds(30));

    /** Used when a job has no submission time at all. */
    private int unknownElapsedProgress = 50;

    public TwoPhase getGpu() {
        return gpu;
    }

    public void setGpu(TwoPhase gpu) {
        this.gpu = gpu;
    }

    public Linear getServerless() {
        return serverless;
    }

    public void setServerless(Linear serverless) {
        this.serverless = serverless;
    }

    public Linear getLocal() {
        return local;
    }

    public void setLocal(Linear local) {
        this.local = local;
    }

    public int getUnknownElapsedProgress() {
        return unknownElapsedProgress;
    }

    public void setUnknownElapsedProgress(int unknownElapsedProgress) {
        this.unknownElapsedProgress = unknownElapsedProgress;
    }

    /**
     * Cold start window ramping {@code coldStartFloor..renderFloor}, then a render window
     * ramping {@code renderFloor..ceiling}.
     */
    public static class TwoPhase {
        private Duration coldStart = Duration.ofSeconds(90);
        private Duration render = Duration.ofSeconds(30);
        private int coldStartFloor = 5;
        private int renderFloor = 35;
        private int ceiling = 95;

        public Duration getColdStart() {
            return coldStart;
        }

        public void setColdStart(Duration coldStart) {
            this.coldStart = coldStart;
        }

        public Duration getRender() {
            return render;
        }

        public void setRender(Duration render) {
            this.render = render;
        }

        public int getColdStartFloor() {
            return coldStartFloor;
        }

        public void setColdStartFloor(int coldStartFloor) {
            this.coldStartFloor = coldStartFloor;
        }

        public int getRenderFloor() {
            return renderFloor;
        }

        public void setRenderFloor(int renderFloor) {
            this.renderFloor = renderFloor;
        }

        public int getCeiling() {
            return ceiling;
        }

        public void setCeiling(int ceiling) {
            this.ceiling = ceiling;
        }
    }

    public static class Linear {
        private Duration expected;
        private int floor = 5;
        private int ceiling = 90;

        public Linear() {
            this(Duration.ofSeconds(50));
        }

        public Linear(Duration expected) {
            this.expected = expected;
        }

        public Duration getExpected() {
            return expected;
        }

        public void setExpected(Duration expected) {
            this.expected = expected;
        }

        public int getFloor() {
            return floor;
        }

        public void setFloor(int floor) {
            this.floor = floor;
        }

        public int getCeiling() {
            return ceiling;
        }

        public void setCeiling(int ceiling) {
            this.ceiling = ceiling;
        }
    }
}
