package com.codeheadsystems.keyring.sample;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.keyring.Entry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SampleStoreConcurrencyTest {

  private static final int THREADS = 8;

  private ExecutorService executor;
  private SampleStore store;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(THREADS);
    store = SampleStore.inMemory();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    executor.shutdownNow();
    executor.awaitTermination(5, TimeUnit.SECONDS);
  }

  @Test
  void concurrentFirstWrites_sameSpecifier_createOneCredential() throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < THREADS; i++) {
      String password = "password " + i;
      futures.add(executor.submit(() -> {
        start.await();
        store.build("svc", "usr", null).setPassword(password);
        return null;
      }));
    }

    start.countDown();
    for (Future<?> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }

    assertThat(store.credentialCount()).isEqualTo(1);
    assertThat(store.build("svc", "usr", null).getPassword()).startsWith("password ");
  }

  @Test
  void concurrentWrites_distinctUsers_allLand() throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < THREADS; i++) {
      String user = "user-" + i;
      futures.add(executor.submit(() -> {
        start.await();
        Entry entry = store.build("svc", user, null);
        for (int round = 0; round < 50; round++) {
          entry.setPassword(user + "/" + round);
        }
        return null;
      }));
    }

    start.countDown();
    for (Future<?> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }

    assertThat(store.credentialCount()).isEqualTo(THREADS);
    for (int i = 0; i < THREADS; i++) {
      assertThat(store.build("svc", "user-" + i, null).getPassword()).isEqualTo("user-" + i + "/49");
    }
  }
}
