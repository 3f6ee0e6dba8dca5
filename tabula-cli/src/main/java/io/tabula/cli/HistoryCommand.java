package io.tabula.cli;

import io.tabula.core.config.model.TabulaConfig;
import io.tabula.core.session.MessageStore;
import io.tabula.core.session.StoredMessage;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "history", description = "Print the stored messages of a session")
public final class HistoryCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-s", "--session"}, required = true, description = "Session id")
    String session;

    public HistoryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TabulaConfig config = context.configService().load(context.configPath());
            MessageStore store = AnalysisRuntime.messageStore(config);
            List<StoredMessage> messages = store.list(session);
            if (messages.isEmpty()) {
                System.out.println("No messages for session " + session);
                return 0;
            }
            for (StoredMessage message : messages) {
                System.out.println("[" + message.role().name().toLowerCase(Locale.ROOT) + "/" + message.type() + "] "
                    + message.text());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("History command failed: " + e.getMessage());
            return 1;
        }
    }
}
