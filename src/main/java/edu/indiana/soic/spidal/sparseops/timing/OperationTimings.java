package edu.indiana.soic.spidal.sparseops.timing;

import com.google.common.base.Stopwatch;

import java.util.concurrent.TimeUnit;

public class OperationTimings {
    public enum TimingTask{
        LOAD, OPERATION, WRITE
    }

    private Stopwatch timerLoad = Stopwatch.createUnstarted();
    private Stopwatch timerOperation = Stopwatch.createUnstarted();
    private Stopwatch timerWrite = Stopwatch.createUnstarted();

    private long tLoad;
    private long tOperation;
    private long tWrite;

    private long countLoad;
    private long countOperation;
    private long countWrite;

    public void startTiming(TimingTask task){
        switch (task){
            case LOAD:
                timerLoad.start();
                ++countLoad;
                break;
            case OPERATION:
                timerOperation.start();
                ++countOperation;
                break;
            case WRITE:
                timerWrite.start();
                ++countWrite;
                break;
        }
    }

    public void endTiming(TimingTask task){
        switch (task){
            case LOAD:
                timerLoad.stop();
                tLoad += timerLoad.elapsed(TimeUnit.MILLISECONDS);
                timerLoad.reset();
                break;
            case OPERATION:
                timerOperation.stop();
                tOperation += timerOperation.elapsed(TimeUnit.MILLISECONDS);
                timerOperation.reset();
                break;
            case WRITE:
                timerWrite.stop();
                tWrite += timerWrite.elapsed(TimeUnit.MILLISECONDS);
                timerWrite.reset();
                break;
        }
    }

    public double getTotalTime(TimingTask task){
        switch (task){
            case LOAD:
                return tLoad;
            case OPERATION:
                return tOperation;
            case WRITE:
                return tWrite;
        }
        return  0.0;
    }

    public long getCount(TimingTask task){
        switch (task){
            case LOAD:
                return countLoad;
            case OPERATION:
                return countOperation;
            case WRITE:
                return countWrite;
        }
        return 0;
    }

    public double getAverageTime(TimingTask task){
        long count = getCount(task);
        return count == 0 ? 0.0 : getTotalTime(task) / count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Timings (ms)...\n");
        for (TimingTask task : TimingTask.values()) {
            sb.append(String.format("  %-9s total=%.0f count=%d average=%.2f%n", task,
                                    getTotalTime(task), getCount(task),
                                    getAverageTime(task)));
        }
        return sb.toString();
    }
}
