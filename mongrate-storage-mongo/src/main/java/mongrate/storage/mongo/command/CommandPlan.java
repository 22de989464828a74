package mongrate.storage.mongo.command;

import com.google.common.collect.ImmutableList;
import mongrate.api.MalformedScriptException;

import java.util.List;

/**
 * The order in which a decoded script is executed.
 *
 * <p>Sequential plans run every command on its own. Transactional plans split the script into a
 * structural prefix, run outside the transaction because MongoDB refuses to create collections or
 * indexes inside one, and a body run inside a single transaction. The split never reorders
 * commands: a structural command that follows a data command makes the script invalid for
 * transactional mode.
 *
 * @param structural commands run before the transaction, in script order
 * @param body commands run in the transaction, in script order
 * @param transactional whether {@code body} runs in a transaction
 */
public record CommandPlan(
    List<MongoCommand> structural, List<MongoCommand> body, boolean transactional) {

  public CommandPlan {
    structural = ImmutableList.copyOf(structural);
    body = ImmutableList.copyOf(body);
  }

  public static CommandPlan sequential(List<MongoCommand> commands) {
    return new CommandPlan(ImmutableList.of(), commands, false);
  }

  /**
   * @throws MalformedScriptException if a structural command comes after a data command
   */
  public static CommandPlan transactional(List<MongoCommand> commands) {
    int split = 0;
    while (split < commands.size() && commands.get(split).structural()) {
      split++;
    }
    for (int i = split; i < commands.size(); i++) {
      MongoCommand command = commands.get(i);
      if (command.structural()) {
        throw new MalformedScriptException(
            "Command #"
                + i
                + " '"
                + command.name()
                + "' cannot run inside a transaction and must come before every data command"
                + " of a transactional script");
      }
    }
    return new CommandPlan(
        commands.subList(0, split), commands.subList(split, commands.size()), true);
  }

  public int size() {
    return structural.size() + body.size();
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /**
   * @return position of the {@code i}-th body command in the original script
   */
  public int scriptIndexOfBody(int i) {
    return structural.size() + i;
  }
}
