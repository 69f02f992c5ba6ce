package com.consullo.rewritetree.dispatch;

import com.consullo.rewritetree.builder.TermPayload;
import com.consullo.rewritetree.builder.TreeBuilder;
import com.consullo.rewritetree.builder.commands.TreeCommand;
import com.consullo.rewritetree.config.VisualizationConfig;
import com.consullo.rewritetree.core.RewriteTree;
import com.consullo.rewritetree.core.TreeNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Tests for serialized command dispatch and finished-tree hand-off.
 *
 * @since 1.0
 */
public class TreeCommandDispatcherTest {

  private static TreeCommandDispatcher dispatcher() {
    return new TreeCommandDispatcher(new TreeBuilder(VisualizationConfig.defaults()));
  }

  @Test
  @DisplayName("Should apply commands in order and hand the finished tree to listeners")
  void submit_FullTree_NotifiesListener() throws Exception {
    final TreeListener listener = mock(TreeListener.class);
    try (TreeCommandDispatcher dispatcher = dispatcher().start()) {
      dispatcher.addTreeListener(listener);

      dispatcher.submit(TreeCommand.newTree("root"));
      dispatcher.submit(TreeCommand.addChild(null, "a", "child1", true));
      dispatcher.submit("addToSubroot", new Object[] {"b", "child2"});
      dispatcher.submit(TreeCommand.addTerm("a", "", TermPayload.of("f(x)")));
      dispatcher.submit(TreeCommand.finishTree()).get(5, TimeUnit.SECONDS);
    }

    final ArgumentCaptor<RewriteTree> captor = ArgumentCaptor.forClass(RewriteTree.class);
    verify(listener, times(1)).onTreeFinished(captor.capture());
    final TreeNode root = captor.getValue().getRoot();
    assertThat(root.childCount()).isEqualTo(2);
    assertThat(root.getChild(0).getLabel()).isEqualTo("child1");
    assertThat(root.getChild(1).getLabel()).isEqualTo("child2");
    assertThat(root.getChild(0).getChild(0).getLabel()).isEqualTo("f(x)");
  }

  @Test
  @DisplayName("Should apply commands queued before start in submission order")
  void submit_ManyCommands_KeepsFifoOrder() throws Exception {
    final TreeListener listener = mock(TreeListener.class);
    final TreeCommandDispatcher dispatcher = dispatcher();
    dispatcher.addTreeListener(listener);

    // queued before the worker runs
    dispatcher.submit(TreeCommand.newTree("root"));
    for (int i = 0; i < 200; i++) {
      dispatcher.submit(TreeCommand.addChild(null, "", "n" + i, true));
    }
    final CompletableFuture<Void> finished = dispatcher.submit(TreeCommand.finishTree());
    assertThat(dispatcher.pendingCommands()).isEqualTo(202);

    try (TreeCommandDispatcher running = dispatcher.start()) {
      finished.get(5, TimeUnit.SECONDS);
    }

    final ArgumentCaptor<RewriteTree> captor = ArgumentCaptor.forClass(RewriteTree.class);
    verify(listener).onTreeFinished(captor.capture());
    final List<TreeNode> children = captor.getValue().getRoot().getChildren();
    final List<String> labels = new ArrayList<>();
    for (TreeNode child : children) {
      labels.add(child.getLabel());
    }
    assertThat(labels).hasSize(200);
    assertThat(labels.get(0)).isEqualTo("n0");
    assertThat(labels.get(199)).isEqualTo("n199");
  }

  @Test
  @DisplayName("Should discard exactly one finished tree after ignoreNextTree")
  void ignoreNextTree_DiscardsOnlyNextTree() throws Exception {
    final TreeListener listener = mock(TreeListener.class);
    try (TreeCommandDispatcher dispatcher = dispatcher().start()) {
      dispatcher.addTreeListener(listener);

      dispatcher.submit(TreeCommand.ignoreNextTree());
      dispatcher.submit(TreeCommand.newTree("hidden"));
      dispatcher.submit(TreeCommand.finishTree()).get(5, TimeUnit.SECONDS);
      verify(listener, never()).onTreeFinished(any());

      dispatcher.submit(TreeCommand.newTree("shown"));
      dispatcher.submit(TreeCommand.finishTree()).get(5, TimeUnit.SECONDS);
    }

    final ArgumentCaptor<RewriteTree> captor = ArgumentCaptor.forClass(RewriteTree.class);
    verify(listener, times(1)).onTreeFinished(captor.capture());
    assertThat(captor.getValue().getRoot().getLabel()).isEqualTo("shown");
  }

  @Test
  @DisplayName("Should fail the future of a finish with no tree and keep serving")
  void submit_FinishWithoutTree_FailsFutureOnly() throws Exception {
    final TreeListener listener = mock(TreeListener.class);
    try (TreeCommandDispatcher dispatcher = dispatcher().start()) {
      dispatcher.addTreeListener(listener);

      final CompletableFuture<Void> failed = dispatcher.submit(TreeCommand.finishTree());
      assertThatThrownBy(() -> failed.get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCauseInstanceOf(IllegalStateException.class);

      dispatcher.submit(TreeCommand.newTree("root"));
      dispatcher.submit(TreeCommand.finishTree()).get(5, TimeUnit.SECONDS);
    }
    verify(listener, times(1)).onTreeFinished(any());
  }

  @Test
  @DisplayName("Should keep notifying other listeners when one throws")
  void finishTree_ListenerThrows_OthersStillNotified() throws Exception {
    final TreeListener failing = mock(TreeListener.class);
    final TreeListener healthy = mock(TreeListener.class);
    doThrow(new IllegalStateException("boom")).when(failing).onTreeFinished(any());

    try (TreeCommandDispatcher dispatcher = dispatcher().start()) {
      dispatcher.addTreeListener(failing);
      dispatcher.addTreeListener(healthy);

      dispatcher.submit(TreeCommand.newTree("root"));
      final CompletableFuture<Void> done = dispatcher.submit(TreeCommand.finishTree());
      done.get(5, TimeUnit.SECONDS);
      assertThat(done).isCompleted();
    }
    verify(healthy).onTreeFinished(any());
  }

  @Test
  @DisplayName("Should stop notifying a removed listener")
  void removeTreeListener_NoLongerNotified() throws Exception {
    final TreeListener listener = mock(TreeListener.class);
    try (TreeCommandDispatcher dispatcher = dispatcher().start()) {
      dispatcher.addTreeListener(listener);
      dispatcher.removeTreeListener(listener);
      dispatcher.submit(TreeCommand.newTree("root"));
      dispatcher.submit(TreeCommand.finishTree()).get(5, TimeUnit.SECONDS);
    }
    verifyNoInteractions(listener);
  }

  @Test
  @DisplayName("Should complete a malformed message's future at once without queuing it")
  void submit_MalformedMessage_Dropped() {
    final TreeCommandDispatcher dispatcher = dispatcher();
    final CompletableFuture<Void> dropped = dispatcher.submit("newTree", 42);

    assertThat(dropped).isCompleted();
    assertThat(dispatcher.pendingCommands()).isZero();
    dispatcher.close();
  }

  @Test
  @DisplayName("Should cancel queued commands on close and refuse new ones")
  void close_PendingAndLaterCommands_Cancelled() throws Exception {
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final TreeListener blocking = tree -> {
      entered.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    };

    final TreeCommandDispatcher dispatcher = dispatcher().start();
    dispatcher.addTreeListener(blocking);
    dispatcher.submit(TreeCommand.newTree("root"));
    dispatcher.submit(TreeCommand.finishTree());
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    final CompletableFuture<Void> queued = dispatcher.submit(TreeCommand.newTree("late"));
    dispatcher.close();
    release.countDown();

    assertThat(queued).isCancelled();
    assertThat(dispatcher.submit(TreeCommand.pushScope())).isCompletedExceptionally();
  }

  @Test
  @DisplayName("Should settle every future when submits race with close")
  void close_RacingSubmit_LeavesNoFutureHanging() throws Exception {
    for (int round = 0; round < 50; round++) {
      final TreeCommandDispatcher dispatcher = dispatcher().start();
      final List<CompletableFuture<Void>> futures = new ArrayList<>();
      final CountDownLatch producing = new CountDownLatch(1);
      final Thread producer = new Thread(() -> {
        for (int i = 0; i < 1_000; i++) {
          futures.add(dispatcher.submit(TreeCommand.pushScope()));
          if (i == 10) {
            producing.countDown();
          }
        }
      });
      producer.start();
      assertThat(producing.await(5, TimeUnit.SECONDS)).isTrue();
      dispatcher.close();
      producer.join(5_000);

      assertThat(producer.isAlive()).isFalse();
      assertThat(futures).hasSize(1_000).allMatch(CompletableFuture::isDone);
    }
  }
}
