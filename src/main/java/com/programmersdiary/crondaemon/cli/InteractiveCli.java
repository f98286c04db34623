package com.programmersdiary.crondaemon.cli;

import com.programmersdiary.crondaemon.chat.ChatService;
import com.programmersdiary.crondaemon.command.CommandRouter;
import com.programmersdiary.crondaemon.session.SessionRegistry;
import com.programmersdiary.crondaemon.session.TransportKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;

@Component
@ConditionalOnProperty(name = "crondaemon.terminal.enabled", havingValue = "true")
public class InteractiveCli implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(InteractiveCli.class);

    public static final String LINEAGE = "terminal";

    private final SessionRegistry sessionRegistry;
    private final ChatService chatService;
    private final CommandRouter commandRouter;
    private final ConfigurableApplicationContext context;
    private final boolean telegramEnabled;
    private final InputStream in;
    private final PrintStream out;

    @Autowired
    public InteractiveCli(SessionRegistry sessionRegistry,
                          ChatService chatService,
                          CommandRouter commandRouter,
                          ConfigurableApplicationContext context,
                          @Value("${crondaemon.telegram.enabled:false}") boolean telegramEnabled) {
        this(sessionRegistry, chatService, commandRouter, context, telegramEnabled, System.in, System.out);
    }

    InteractiveCli(SessionRegistry sessionRegistry,
                   ChatService chatService,
                   CommandRouter commandRouter,
                   ConfigurableApplicationContext context,
                   boolean telegramEnabled,
                   InputStream in,
                   PrintStream out) {
        this.sessionRegistry = sessionRegistry;
        this.chatService = chatService;
        this.commandRouter = commandRouter;
        this.context = context;
        this.telegramEnabled = telegramEnabled;
        this.in = in;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        var scanner = new Scanner(in);
        var session = sessionRegistry.attach(TransportKind.TERMINAL, LINEAGE, this::print);

        print("\n=== Cron Daemon Interactive Chat ===\n");
        print("Type /help for commands, /quit to exit.\n");

        try {
            while (true) {
                if (!scanner.hasNextLine()) break;
                var input = scanner.nextLine().trim();

                if (input.isEmpty()) continue;
                if (input.equalsIgnoreCase("/quit") || input.equalsIgnoreCase("/exit")) break;

                try {
                    if (CommandRouter.isCommand(input)) {
                        print(commandRouter.execute(input, LINEAGE).output() + "\n");
                        continue;
                    }

                    var reply = chatService.chat(LINEAGE, input);
                    reply.notices().forEach(notice -> print(notice + "\n"));
                    print("\nAI: " + reply.text() + "\n");
                } catch (RuntimeException e) {
                    log.error("Terminal input failed: {}", e.getMessage(), e);
                    print("\nError: " + e.getMessage() + "\n");
                }
            }
        } finally {
            sessionRegistry.detach(session.handle());
        }

        print("Goodbye!");
        if (!telegramEnabled && context != null) {
            context.close();
        }
    }

    private void print(String text) {
        synchronized (out) {
            out.println(text);
            out.flush();
        }
    }
}
