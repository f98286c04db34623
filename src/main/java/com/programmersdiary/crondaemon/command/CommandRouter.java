package com.programmersdiary.crondaemon.command;

import com.programmersdiary.crondaemon.chat.ConversationService;
import com.programmersdiary.crondaemon.memory.MemoryService;
import com.programmersdiary.crondaemon.scheduling.InvalidScheduleException;
import com.programmersdiary.crondaemon.scheduling.JobNotFoundException;
import com.programmersdiary.crondaemon.scheduling.JobScope;
import com.programmersdiary.crondaemon.scheduling.ScheduledJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Locale;

/**
 * Slash commands shared by every transport. The lineage identifies whose conversation
 * {@code /clear} applies to and who created a job.
 */
@Component
public class CommandRouter {

    private static final Logger log = LoggerFactory.getLogger(CommandRouter.class);

    static final String HELP = """
            🤖 Cron daemon is online!

            Just send me a message to chat, or use:
            /status - System status
            /jobs - List scheduled tasks
            /schedule <cron> <prompt> - Create a cron job
            /cancel <job_id> - Cancel a scheduled job
            /memory - View saved memories
            /forget - Clear all memories
            /clear - Clear conversation history
            /help - Show all commands""";

    static final String SCHEDULE_USAGE = """
            Usage: /schedule <cron> <prompt>

            The prompt will be sent to me when the job triggers.

            Cron format: minute hour day month weekday

            Examples:
            /schedule */3 * * * * Tell me a joke
            /schedule 0 9 * * * Give me a motivational quote
            /schedule 30 14 * * 1-5 Remind me to stand up

            Common patterns:
            • */5 * * * * - Every 5 minutes
            • 0 * * * * - Every hour
            • 0 9 * * * - Daily at 9am
            • 0 9 * * 1 - Every Monday at 9am""";

    private final ScheduledJobService jobService;
    private final StatusService statusService;
    private final ConversationService conversationService;
    private final MemoryService memoryService;

    public CommandRouter(ScheduledJobService jobService,
                         StatusService statusService,
                         ConversationService conversationService,
                         MemoryService memoryService) {
        this.jobService = jobService;
        this.statusService = statusService;
        this.conversationService = conversationService;
        this.memoryService = memoryService;
    }

    public static boolean isCommand(String text) {
        return text != null && text.strip().startsWith("/");
    }

    public CommandResult execute(String commandLine, String lineage) {
        var parts = commandLine.strip().split("\\s+", 2);
        var command = parts[0].toLowerCase(Locale.ROOT);
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        var args = parts.length > 1 ? parts[1].strip() : "";
        try {
            return switch (command) {
                case "/start", "/help" -> CommandResult.success(HELP);
                case "/status" -> CommandResult.success(statusService.status().format());
                case "/jobs" -> listJobs();
                case "/schedule" -> schedule(args, lineage);
                case "/cancel" -> cancel(args);
                case "/clear" -> clear(lineage);
                case "/memory" -> showMemory();
                case "/forget" -> forget();
                default -> CommandResult.failure("Unknown command: " + command + ". Type /help for the list.");
            };
        } catch (UncheckedIOException e) {
            log.error("Command {} failed to save: {}", command, e.getMessage());
            return CommandResult.failure("❌ Could not save the change: " + e.getMessage());
        }
    }

    private CommandResult listJobs() {
        var jobs = jobService.list(false);
        if (jobs.isEmpty()) {
            return CommandResult.success("No scheduled jobs. Ask me to schedule something!");
        }
        var sb = new StringBuilder("🕐 Scheduled Jobs\n");
        for (var job : jobs) {
            var next = jobService.nextFire(job).map(Object::toString).orElse("never");
            sb.append("\n#").append(job.id()).append(" - ").append(job.task())
                    .append("\n  Schedule: ").append(job.cronExpression())
                    .append("\n  Next: ").append(next);
            if (job.scope() != JobScope.ALL) {
                sb.append("\n  Scope: ").append(job.scope().name().toLowerCase(Locale.ROOT));
            }
        }
        return CommandResult.success(sb.toString());
    }

    private CommandResult schedule(String args, String lineage) {
        var fields = args.isEmpty() ? new String[0] : args.split("\\s+", 6);
        if (fields.length < 5) {
            return CommandResult.failure(SCHEDULE_USAGE);
        }
        var prompt = fields.length == 6 ? fields[5].strip() : "";
        if (prompt.isEmpty()) {
            return CommandResult.failure("❌ Prompt cannot be empty.\nUsage: /schedule <cron> <prompt>");
        }
        var cron = String.join(" ", Arrays.copyOf(fields, 5));
        try {
            var job = jobService.create(cron, null, prompt, JobScope.ALL, lineage);
            return CommandResult.success("✅ Scheduled job #" + job.id() + ": " + job.task()
                    + "\nSchedule: " + job.cronExpression()
                    + "\nMessage: " + job.message());
        } catch (InvalidScheduleException e) {
            return CommandResult.failure("❌ " + e.getMessage() + "\nUsage: /schedule <cron> <prompt>");
        }
    }

    private CommandResult cancel(String args) {
        if (args.isEmpty()) {
            return CommandResult.failure("Usage: /cancel <job_id>");
        }
        long id;
        try {
            id = Long.parseLong(args.split("\\s+")[0]);
        } catch (NumberFormatException e) {
            return CommandResult.failure("Job ID must be a number.");
        }
        try {
            jobService.cancel(id);
            return CommandResult.success("✅ Cancelled job #" + id);
        } catch (JobNotFoundException e) {
            return CommandResult.failure(e.getMessage());
        }
    }

    private CommandResult showMemory() {
        if (memoryService.facts().isEmpty()) {
            return CommandResult.success("🧠 My Memory\n\nNo memories saved yet. Tell me something about yourself!");
        }
        var sb = new StringBuilder("🧠 My Memory (").append(memoryService.lineCount()).append(" lines)\n\n");
        if (memoryService.isLarge()) {
            sb.append("⚠️ Memory is getting large!\n\n");
        }
        return CommandResult.success(sb.append(memoryService.render()).toString());
    }

    private CommandResult forget() {
        memoryService.forget();
        return CommandResult.success("🧹 All memories have been forgotten.");
    }

    private CommandResult clear(String lineage) {
        conversationService.clear(lineage);
        return CommandResult.success("🧹 Conversation history cleared.");
    }
}
