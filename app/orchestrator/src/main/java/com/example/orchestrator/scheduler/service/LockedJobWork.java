/*
 * どこで: Scheduler サービス層
 * 何を: ロック保持中のハンドラ 1 回分の作業をワーカースレッドへ渡す
 * なぜ: タイムアウト後もハンドラが終わるまでジョブ名のロックを保持し続けるため
 */
package com.example.orchestrator.scheduler.service;

import com.example.orchestrator.scheduler.handler.JobHandler;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ロックは呼び出し側 (記録処理) とワーカー (ハンドラ本体) の 2 者が共有し、遅く終わった側が解放する。
 *
 * <p>割り込みを無視するハンドラがタイムアウト後も動き続けている間、同名ジョブは実行中のまま扱われる。
 */
final class LockedJobWork implements Callable<String> {

  private final String jobName;
  private final JobHandler handler;
  private final JobLockRegistry lockRegistry;
  private final AtomicInteger holders = new AtomicInteger(2);
  private Thread worker;
  private boolean abandoned;

  LockedJobWork(String jobName, JobHandler handler, JobLockRegistry lockRegistry) {
    this.jobName = jobName;
    this.handler = handler;
    this.lockRegistry = lockRegistry;
  }

  @Override
  public String call() throws Exception {
    synchronized (this) {
      if (abandoned) {
        releaseOne();
        throw new CancellationException("abandoned before start");
      }
      worker = Thread.currentThread();
    }
    try {
      return handler.run();
    } finally {
      synchronized (this) {
        worker = null;
        // abandon() の割り込みをプールの次のタスクへ持ち越さない
        Thread.interrupted();
      }
      releaseOne();
    }
  }

  /** タイムアウト時に呼ぶ。実行中なら割り込み、未開始ならハンドラを呼ばせない。 */
  synchronized void abandon() {
    abandoned = true;
    if (worker != null) {
      worker.interrupt();
    }
  }

  /** ワーカーへ投入できなかった場合に、ワーカー側の持ち分を手放す。 */
  void notStarted() {
    releaseOne();
  }

  /** 呼び出し側の持ち分を手放す。記録処理の後に 1 回だけ呼ぶ。 */
  void callerDone() {
    releaseOne();
  }

  private void releaseOne() {
    if (holders.decrementAndGet() == 0) {
      lockRegistry.release(jobName);
    }
  }
}
