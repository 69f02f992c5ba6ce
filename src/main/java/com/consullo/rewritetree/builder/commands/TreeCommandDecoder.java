package com.consullo.rewritetree.builder.commands;

import com.consullo.rewritetree.builder.TermPayload;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns loosely typed {@code (name, args)} messages from the rewriting engine
 * into {@link TreeCommand}s.
 *
 * <p>
 * Arguments may be absent, a single value, an {@code Object[]} or a
 * {@link List}. Recognised shapes:
 * <ul>
 * <li>{@code newTree(label)}</li>
 * <li>{@code finishTree}, {@code pushScope}, {@code popScope},
 * {@code saveNodeCount}, {@code ignoreNextTree} (arguments ignored)</li>
 * <li>{@code setSubroot(id)}, {@code removeLastChild(parentId)}</li>
 * <li>{@code addToSubroot(id, comment)}, {@code addToSubroot(id, term)},
 * {@code addToSubroot(id, comment, term)}</li>
 * <li>{@code addTo(parentId, id, comment)}, {@code addTo(parentId, id, term)},
 * {@code addTo(parentId, id, comment, term)}</li>
 * <li>{@code restoreNodeCount(flag)}, {@code toggleIgnore(flag)}</li>
 * </ul>
 * where {@code term} is a {@link TermPayload}. Anything else is logged and
 * dropped.
 * </p>
 */
public final class TreeCommandDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(TreeCommandDecoder.class);

  private TreeCommandDecoder() {
  }

  /**
   * Decodes a producer message.
   *
   * @param name command name
   * @param args command arguments
   * @return decoded command, or empty if the message is malformed
   */
  public static Optional<TreeCommand> decode(String name, Object args) {
    if (name == null) {
      LOGGER.warn("Dropping tree command with no name: {}", describe(args));
      return Optional.empty();
    }

    List<Object> a = toList(args);
    TreeCommand cmd = null;
    switch (name) {
      case "newTree":
        if (a.size() == 1 && a.get(0) instanceof String) {
          cmd = TreeCommand.newTree((String) a.get(0));
        }
        break;
      case "finishTree":
        cmd = TreeCommand.finishTree();
        break;
      case "pushScope":
        cmd = TreeCommand.pushScope();
        break;
      case "popScope":
        cmd = TreeCommand.popScope();
        break;
      case "saveNodeCount":
        cmd = TreeCommand.saveNodeCount();
        break;
      case "ignoreNextTree":
        cmd = TreeCommand.ignoreNextTree();
        break;
      case "setSubroot":
        if (a.size() == 1 && a.get(0) instanceof String) {
          cmd = TreeCommand.setSubroot((String) a.get(0));
        }
        break;
      case "removeLastChild":
        if (a.size() == 1 && a.get(0) instanceof String) {
          cmd = TreeCommand.removeLastChild((String) a.get(0));
        }
        break;
      case "addToSubroot":
        cmd = decodeAddition(null, a);
        break;
      case "addTo":
        if (!a.isEmpty() && a.get(0) instanceof String) {
          cmd = decodeAddition((String) a.get(0), a.subList(1, a.size()));
        }
        break;
      case "restoreNodeCount":
        if (a.size() == 1 && a.get(0) instanceof Boolean) {
          cmd = TreeCommand.restoreNodeCount((Boolean) a.get(0));
        }
        break;
      case "toggleIgnore":
        if (a.size() == 1 && a.get(0) instanceof Boolean) {
          cmd = TreeCommand.toggleIgnore((Boolean) a.get(0));
        }
        break;
      default:
        LOGGER.warn("Dropping unknown tree command: {}", name);
        return Optional.empty();
    }

    if (cmd == null) {
      LOGGER.warn("Tree command {} received incorrect arguments: {}", name, describe(args));
    }
    return Optional.ofNullable(cmd);
  }

  // rest = (id, comment) | (id, term) | (id, comment, term)
  private static TreeCommand decodeAddition(String parentId, List<Object> rest) {
    if (rest.size() < 2 || !(rest.get(0) instanceof String)) {
      return null;
    }
    String newId = (String) rest.get(0);
    if (rest.size() == 2) {
      Object second = rest.get(1);
      if (second instanceof String) {
        return TreeCommand.addChild(parentId, newId, (String) second, true);
      }
      if (second instanceof TermPayload) {
        return TreeCommand.addTerm(parentId, newId, (TermPayload) second);
      }
      return null;
    }
    if (rest.size() == 3 && rest.get(1) instanceof String && rest.get(2) instanceof TermPayload) {
      return TreeCommand.addCommentWithTerm(parentId, newId, (String) rest.get(1), (TermPayload) rest.get(2));
    }
    return null;
  }

  private static List<Object> toList(Object args) {
    if (args == null) {
      return List.of();
    }
    if (args instanceof Object[]) {
      return Arrays.asList((Object[]) args);
    }
    if (args instanceof List) {
      return new ArrayList<Object>((List<?>) args);
    }
    return Arrays.asList(args);
  }

  private static String describe(Object args) {
    if (args instanceof Object[]) {
      return Arrays.deepToString((Object[]) args);
    }
    return String.valueOf(args);
  }
}
