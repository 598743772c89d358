package com.marketdesk.marketdata.chat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class CommandRegistry {

  private final Map<String, CommandDef> byCommand;
  private final List<CommandDef> all;

  public CommandRegistry() {
    List<CommandDef> defs =
        List.of(
            new CommandDef("help", "/help", "/help", "list commands"),
            new CommandDef("quote", "/quote", "/quote <SYMBOL>", "stock or ETF quote"),
            new CommandDef(
                "crypto", "/crypto", "/crypto <BASE> [COUNTER=USD]", "crypto best bid/ask"),
            new CommandDef(
                "book", "/book", "/book <BASE-COUNTER> [width=18]", "order book depth chart"),
            new CommandDef(
                "options",
                "/options",
                "/options <TICKER> <call|put> <MM/DD/YY>",
                "strikes around the underlying"),
            new CommandDef("orders", "/orders", "/orders [limit=5]", "recent crypto orders (1-20)"));

    Map<String, CommandDef> byCmd = new HashMap<>();
    for (CommandDef def : defs) {
      byCmd.put(def.command(), def);
    }
    byCmd.put("/start", byCmd.get("/help"));

    this.all = List.copyOf(defs);
    this.byCommand = Map.copyOf(byCmd);
  }

  public List<CommandDef> all() {
    return all;
  }

  public CommandDef byCommand(String command) {
    return byCommand.get(command);
  }

  public record CommandDef(String code, String command, String usage, String description) {}
}
