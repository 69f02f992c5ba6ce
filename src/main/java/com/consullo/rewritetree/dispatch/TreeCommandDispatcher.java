package com.consullo.rewritetree.dispatch;

import com.consullo.rewritetree.builder.TreeBuilder;
import com.consullo.rewritetree.builder.commands.TreeCommand;
import com.consullo.rewritetree.builder.commands.TreeCommandDecoder;
import com.consullo.rewritetree.core.RewriteTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes all tree-construction commands onto a single worker thread.
 *
 * <p>
 * Producers call {@link #submit(TreeCommand)} from any thread. Commands run in
 * submission order, one at a time, against the owned {@link TreeBuilder}, so
 * the builder is never touched by two threads. When a {@code FINISH_TREE}
 * command runs, the finished tree is handed to every registered
 * {@link TreeListener} on the worker thread.
 * </p>
 *
 * <p>
 * A command that throws (for example finishing with no tree in progress) fails
 * its own future and is logged; the worker keeps going.
 * </p>
 */
public final class TreeCommandDispatcher implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(TreeCommandDispatcher.class);

  private static final long CLOSE_TIMEOUT_MILLIS = 2_000L;

  private static final class Envelope {
    final TreeCommand command;
    final CompletableFuture<Void> done;

    Envelope(TreeCommand command, CompletableFuture<Void> done) {
      this.command = command;
      this.done = done;
    }
  }

  private final TreeBuilder builder;
  private final BlockingQueue<Envelope> mailbox = new LinkedBlockingQueue<>();
  private final Object lock = new Object();
  // guards the closed flag against mailbox adds
  private final Object mailboxLock = new Object();
  private final List<TreeListener> listeners = new ArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final Thread worker;

  // worker thread only
  private boolean ignoreNextTree;

  public TreeCommandDispatcher(TreeBuilder builder) {
    Validate.notNull(builder, "builder must not be null.");
    this.builder = builder;
    this.worker = new Thread(this::dispatchLoop, "TreeBuilderDispatch");
    this.worker.setDaemon(true);
  }

  /**
   * Starts the worker thread. Commands submitted earlier are processed once it
   * runs.
   *
   * @return this dispatcher
   */
  public TreeCommandDispatcher start() {
    if (started.compareAndSet(false, true)) {
      worker.start();
      LOGGER.info("Tree command dispatcher started");
    }
    return this;
  }

  /**
   * Queues a command.
   *
   * @param command command to run
   * @return future completed once the command has been applied
   */
  public CompletableFuture<Void> submit(TreeCommand command) {
    Validate.notNull(command, "command must not be null.");
    CompletableFuture<Void> done = new CompletableFuture<>();
    synchronized (mailboxLock) {
      if (closed.get()) {
        done.completeExceptionally(new CancellationException("Dispatcher is closed"));
        return done;
      }
      mailbox.add(new Envelope(command, done));
    }
    return done;
  }

  /**
   * Decodes and queues a loosely typed producer message. Malformed messages are
   * logged and dropped; their future completes immediately.
   *
   * @param name command name
   * @param args command arguments
   * @return future completed once the command has been applied or dropped
   */
  public CompletableFuture<Void> submit(String name, Object args) {
    Optional<TreeCommand> command = TreeCommandDecoder.decode(name, args);
    if (command.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    return submit(command.get());
  }

  public void addTreeListener(TreeListener listener) {
    Validate.notNull(listener, "listener must not be null.");
    synchronized (lock) {
      listeners.add(listener);
    }
  }

  public void removeTreeListener(TreeListener listener) {
    synchronized (lock) {
      listeners.remove(listener);
    }
  }

  /**
   * Number of commands waiting to run.
   *
   * @return queue length
   */
  public int pendingCommands() {
    return mailbox.size();
  }

  private void dispatchLoop() {
    try {
      while (!Thread.currentThread().isInterrupted()) {
        Envelope envelope = mailbox.take();
        runCommand(envelope);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      LOGGER.debug("Tree command dispatcher loop exited");
    }
  }

  private void runCommand(Envelope envelope) {
    try {
      apply(envelope.command);
      envelope.done.complete(null);
    } catch (RuntimeException e) {
      LOGGER.error("Tree command {} failed", envelope.command, e);
      envelope.done.completeExceptionally(e);
    }
  }

  private void apply(TreeCommand cmd) {
    switch (cmd.type()) {
      case NEW_TREE:
        builder.newTree(cmd.label());
        break;
      case FINISH_TREE:
        finishTree();
        break;
      case PUSH_SCOPE:
        builder.pushScope();
        break;
      case POP_SCOPE:
        builder.popScope();
        break;
      case SET_SUBROOT:
        builder.setSubroot(cmd.targetId());
        break;
      case ADD_CHILD:
        if (cmd.payload() == null) {
          builder.addChild(cmd.targetId(), cmd.newId(), cmd.label(), cmd.comment());
        } else if (cmd.label() == null) {
          builder.addTerm(cmd.targetId(), cmd.newId(), cmd.payload());
        } else {
          builder.addCommentWithTerm(cmd.targetId(), cmd.newId(), cmd.label(), cmd.payload());
        }
        break;
      case REMOVE_LAST_CHILD:
        builder.removeLastChild(cmd.targetId());
        break;
      case SAVE_NODE_COUNT:
        builder.saveNodeCount();
        break;
      case RESTORE_NODE_COUNT:
        builder.restoreNodeCount(cmd.flag());
        break;
      case TOGGLE_IGNORE:
        builder.toggleIgnore(cmd.flag());
        break;
      case IGNORE_NEXT_TREE:
        ignoreNextTree = true;
        break;
      default:
        LOGGER.warn("Unhandled tree command: {}", cmd);
    }
  }

  private void finishTree() {
    RewriteTree tree = builder.finishTree();
    if (ignoreNextTree) {
      ignoreNextTree = false;
      LOGGER.info("Discarding finished tree '{}' as requested", tree.getRoot().getLabel());
      return;
    }
    LOGGER.info("Publishing finished tree '{}'", tree.getRoot().getLabel());

    List<TreeListener> copy;
    synchronized (lock) {
      copy = new ArrayList<>(listeners);
    }
    for (TreeListener listener : copy) {
      try {
        listener.onTreeFinished(tree);
      } catch (RuntimeException e) {
        LOGGER.warn("Tree listener {} failed: {}", listener, e.getMessage(), e);
      }
    }
  }

  /**
   * Stops the worker. Commands still queued are cancelled, including any
   * submitted concurrently with this call.
   */
  @Override
  public void close() {
    synchronized (mailboxLock) {
      if (!closed.compareAndSet(false, true)) {
        return;
      }
    }
    worker.interrupt();
    try {
      if (started.get()) {
        worker.join(CLOSE_TIMEOUT_MILLIS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }

    List<Envelope> pending = new ArrayList<>();
    mailbox.drainTo(pending);
    for (Envelope envelope : pending) {
      envelope.done.cancel(false);
    }
    if (!pending.isEmpty()) {
      LOGGER.info("Cancelled {} pending tree commands on close", pending.size());
    }
  }
}
