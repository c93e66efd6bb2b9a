/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.tlang.service;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.util.concurrent.Futures;

import exm.tlang.common.Settings;
import exm.tlang.common.exceptions.ErrorKind;
import exm.tlang.common.exceptions.InvalidOptionException;
import exm.tlang.common.exceptions.TimeoutException;
import exm.tlang.ui.RunResult;
import exm.tlang.ui.TLangRunner;

/**
 * Runs programs on dedicated worker threads, bounding each run by a
 * wall-clock timeout.  Workers are created with an explicit stack size so
 * deep recursion in the interpreted program hits the call depth limit
 * before the host stack runs out.
 *
 * On timeout the worker is interrupted; the interpreter notices at the next
 * loop iteration or call and stops.
 */
public class ExecutionService {
  public static final String EMPTY_SOURCE_MSG = "source code cannot be empty";

  private final Logger logger;
  private final TLangRunner runner;
  private final long timeoutMs;
  private final ExecutorService workers;

  public ExecutionService(Logger logger, TLangRunner runner, int numWorkers,
                          long stackSize, long timeoutMs) {
    this.logger = logger;
    this.runner = runner;
    this.timeoutMs = timeoutMs;
    this.workers = Executors.newFixedThreadPool(numWorkers,
                                    new WorkerThreadFactory(stackSize));
  }

  /**
   * Single worker, with limits taken from Settings
   * @throws InvalidOptionException
   */
  public static ExecutionService fromSettings(Logger logger)
      throws InvalidOptionException {
    return new ExecutionService(logger, TLangRunner.fromSettings(logger), 1,
                       Settings.getLong(Settings.THREAD_STACK_SIZE),
                       Settings.getLong(Settings.TIMEOUT_MS));
  }

  /**
   * Queue a program for execution.
   * @param source
   * @return future result.  Blank source is rejected immediately.
   */
  public Future<RunResult> submit(final String source) {
    if (StringUtils.isBlank(source)) {
      return Futures.immediateFuture(
          RunResult.failure("", null, EMPTY_SOURCE_MSG));
    }
    return workers.submit(new Callable<RunResult>() {
      @Override
      public RunResult call() {
        return runner.run(source);
      }
    });
  }

  /**
   * Run a program, waiting at most the configured timeout.
   * @param source
   * @return result of the run, or a Timeout failure
   */
  public RunResult execute(String source) {
    Future<RunResult> future = submit(source);
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (java.util.concurrent.TimeoutException e) {
      future.cancel(true);
      logger.debug("Run timed out after " + timeoutMs + "ms");
      return timedOut("Execution timed out after " + timeoutMs + " ms");
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return timedOut("Interrupted while waiting for execution");
    } catch (ExecutionException e) {
      // Runner reports its own failures, so this is a bug
      TLangRunner.reportInternalError(logger, e.getCause());
      return RunResult.failure("", ErrorKind.INTERNAL_ERROR,
                      ErrorKind.INTERNAL_ERROR + ": " + e.getCause());
    }
  }

  private static RunResult timedOut(String msg) {
    TimeoutException e = new TimeoutException(0, msg);
    return RunResult.failure("", e.getKind(), e.getMessage());
  }

  /**
   * Stop accepting work and interrupt any running program
   */
  public void shutdown() {
    workers.shutdownNow();
  }

  private static class WorkerThreadFactory implements ThreadFactory {
    private final AtomicInteger count = new AtomicInteger(0);
    private final long stackSize;

    WorkerThreadFactory(long stackSize) {
      this.stackSize = stackSize;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(null, r, "tlang-worker-" + count.incrementAndGet(),
                            stackSize);
      t.setDaemon(true);
      return t;
    }
  }
}
