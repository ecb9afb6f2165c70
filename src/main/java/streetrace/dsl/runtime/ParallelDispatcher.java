package streetrace.dsl.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * parallel do 分支的并发执行器
 * <p>
 * 所有分支同时提交，全部完成后按 target 汇总结果；任一分支失败则整体失败，
 * 超时取消尚未完成的分支。结果与完成顺序无关。
 * <p>
 * 分支内部再遇到 parallel do（经由嵌套 flow）时在当前工作线程上顺序执行，
 * 不再向同一个固定线程池提交，避免外层分支占满线程后内层任务永远排不上。
 */
public final class ParallelDispatcher implements AutoCloseable {
  private static final Logger LOGGER = Logger.getLogger(ParallelDispatcher.class.getName());

  /** 单个分支的执行方式 */
  @FunctionalInterface
  public interface BranchInvoker {
    Object invoke(RuntimeEvent.ParallelSuspension.Branch branch) throws Exception;
  }

  private static final ThreadLocal<Boolean> WORKER = ThreadLocal.withInitial(() -> Boolean.FALSE);

  private final ExecutorService executor;
  private final long timeoutSeconds;

  public ParallelDispatcher() {
    this(RuntimeConfig.PARALLEL_THREADS, RuntimeConfig.PARALLEL_TIMEOUT_SECONDS);
  }

  public ParallelDispatcher(int threads, long timeoutSeconds) {
    AtomicInteger counter = new AtomicInteger();
    this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
      Thread t = new Thread(() -> {
        WORKER.set(Boolean.TRUE);
        r.run();
      }, "streetrace-parallel-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
    this.timeoutSeconds = timeoutSeconds;
  }

  /**
   * 并发执行所有分支
   *
   * @return target → 结果；没有 target 的分支结果被丢弃
   * @throws WorkflowRuntimeException 分支失败、超时或等待被中断
   */
  public Map<String, Object> dispatch(List<RuntimeEvent.ParallelSuspension.Branch> branches, BranchInvoker invoker) {
    if (WORKER.get()) {
      return dispatchInline(branches, invoker);
    }
    List<CompletableFuture<Object>> futures = new ArrayList<>(branches.size());
    for (RuntimeEvent.ParallelSuspension.Branch branch : branches) {
      futures.add(CompletableFuture.supplyAsync(() -> {
        try {
          return invoker.invoke(branch);
        } catch (RuntimeException e) {
          throw e;
        } catch (Exception e) {
          throw new CompletionException(e);
        }
      }, executor));
    }

    CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    try {
      all.get(timeoutSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      futures.forEach(f -> f.cancel(true));
      throw new WorkflowRuntimeException(RuntimeErrors.parallelTimeout(timeoutSeconds), e);
    } catch (ExecutionException e) {
      futures.forEach(f -> f.cancel(true));
      Throwable cause = unwrap(e.getCause());
      if (cause instanceof WorkflowRuntimeException w) {
        throw w;
      }
      throw new WorkflowRuntimeException("parallel branch failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      futures.forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new WorkflowRuntimeException("parallel block interrupted", e);
    }

    Map<String, Object> results = new LinkedHashMap<>();
    for (int i = 0; i < branches.size(); i++) {
      String target = branches.get(i).target;
      if (target != null) {
        results.put(target, futures.get(i).join());
      }
    }
    LOGGER.log(Level.FINE, "parallel block finished with {0} branches", branches.size());
    return results;
  }

  private static Map<String, Object> dispatchInline(List<RuntimeEvent.ParallelSuspension.Branch> branches,
                                                    BranchInvoker invoker) {
    LOGGER.log(Level.FINE, "nested parallel block with {0} branches runs on {1}",
        new Object[]{branches.size(), Thread.currentThread().getName()});
    Map<String, Object> results = new LinkedHashMap<>();
    for (RuntimeEvent.ParallelSuspension.Branch branch : branches) {
      Object result;
      try {
        result = invoker.invoke(branch);
      } catch (WorkflowRuntimeException e) {
        throw e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new WorkflowRuntimeException("parallel block interrupted", e);
      } catch (Exception e) {
        throw new WorkflowRuntimeException("parallel branch failed: " + e.getMessage(), e);
      }
      if (branch.target != null) {
        results.put(branch.target, result);
      }
    }
    return results;
  }

  private static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
