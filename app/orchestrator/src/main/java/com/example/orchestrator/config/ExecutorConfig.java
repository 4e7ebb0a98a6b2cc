/*
 * どこで: Orchestrator 設定
 * 何を: ジョブ実行と通知送信のスレッドプールを定義する
 * なぜ: tick/手動実行/通知ファンアウトが互いのスレッドを食い潰さないようにするため
 */
package com.example.orchestrator.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

  public static final String JOB_EXECUTOR = "jobExecutor";
  public static final String JOB_WORK_EXECUTOR = "jobWorkExecutor";
  public static final String NOTIFICATION_EVENT_EXECUTOR = "notificationEventExecutor";
  public static final String NOTIFICATION_SEND_EXECUTOR = "notificationSendExecutor";

  /** tick から投入されたジョブの監督スレッド。 */
  @Bean(name = JOB_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService jobExecutor(SchedulerProperties properties) {
    return Executors.newFixedThreadPool(properties.workerThreads(), threadFactory("job-runner-%d"));
  }

  /** タイムアウト監視下でハンドラ本体を動かすスレッド。割り込みで打ち切る。 */
  @Bean(name = JOB_WORK_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService jobWorkExecutor() {
    return Executors.newCachedThreadPool(threadFactory("job-work-%d"));
  }

  @Bean(name = NOTIFICATION_EVENT_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService notificationEventExecutor() {
    return Executors.newFixedThreadPool(2, threadFactory("notify-event-%d"));
  }

  @Bean(name = NOTIFICATION_SEND_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService notificationSendExecutor(NotificationDeliveryProperties properties) {
    return Executors.newFixedThreadPool(
        properties.dispatchThreads(), threadFactory("notify-send-%d"));
  }

  private static ThreadFactory threadFactory(String nameFormat) {
    return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
  }
}
