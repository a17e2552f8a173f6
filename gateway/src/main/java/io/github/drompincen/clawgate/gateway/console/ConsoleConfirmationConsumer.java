package io.github.drompincen.clawgate.gateway.console;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawgate.protocol.api.ConfirmationRequestDto;
import io.github.drompincen.clawgate.protocol.api.ConfirmationResponse;
import io.github.drompincen.clawgate.runtime.permission.ConfirmationListener;
import io.github.drompincen.clawgate.runtime.permission.ConfirmationQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Answers confirmations from the terminal, one prompt per shown item. Prompts are queued
 * behind each other, so an item withdrawn while an earlier prompt waits is skipped.
 *
 * <pre>
 *   y              allow once
 *   a              always allow (stores the suggested rules)
 *   n [reason]     deny
 *   r &lt;text&gt;       deny and tell the model what to do instead
 *   esc / empty    cancel
 * </pre>
 */
@Component
@ConditionalOnProperty(name = "clawgate.console.enabled", havingValue = "true")
public class ConsoleConfirmationConsumer implements ConfirmationListener {

    private static final Logger log = LoggerFactory.getLogger(ConsoleConfirmationConsumer.class);

    static final String NO_LONGER_PENDING = "That request is no longer pending; the answer was discarded.";

    enum Kind {
        RESPOND,
        CANCEL,
        RETRY
    }

    record Answer(Kind kind, ConfirmationResponse response) {
        static Answer respond(ConfirmationResponse response) {
            return new Answer(Kind.RESPOND, response);
        }

        static final Answer CANCEL = new Answer(Kind.CANCEL, null);
        static final Answer RETRY = new Answer(Kind.RETRY, null);
    }

    private final ConfirmationQueue confirmationQueue;
    private final ObjectMapper objectMapper;
    private final BufferedReader in;
    private final PrintStream out;
    private final ExecutorService reader = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "console-confirmation");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public ConsoleConfirmationConsumer(ConfirmationQueue confirmationQueue, ObjectMapper objectMapper) {
        this(confirmationQueue, objectMapper,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    ConsoleConfirmationConsumer(ConfirmationQueue confirmationQueue, ObjectMapper objectMapper,
                                BufferedReader in, PrintStream out) {
        this.confirmationQueue = confirmationQueue;
        this.objectMapper = objectMapper;
        this.in = in;
        this.out = out;
    }

    @PostConstruct
    public void attach() {
        confirmationQueue.addListener(this);
        log.debug("Console confirmation consumer attached");
    }

    @PreDestroy
    public void detach() {
        confirmationQueue.removeListener(this);
        reader.shutdownNow();
    }

    @Override
    public void onShowing(ConfirmationRequestDto request) {
        reader.execute(() -> prompt(request));
    }

    @Override
    public void onIdle() {
        log.debug("No confirmation pending");
    }

    void prompt(ConfirmationRequestDto request) {
        if (!stillShowing(request)) {
            log.debug("Skipping prompt for {}; it is no longer shown", request.requestId());
            return;
        }
        out.println();
        out.println("Permission required: " + request.toolName() + " " + render(request));
        if (request.persistentOptionAvailable()) {
            out.println("  [a] always allow: " + String.join(", ", request.suggestedRules()));
        }
        out.println("  [y] allow once  [n <reason>] deny  [r <instructions>] redirect  [esc] cancel");

        while (true) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                log.warn("Reading the console failed; cancelling {}: {}", request.requestId(), e.getMessage());
                line = null;
            }

            if (!stillShowing(request)) {
                out.println(NO_LONGER_PENDING);
                return;
            }

            Answer answer = parseAnswer(line, request.persistentOptionAvailable());
            switch (answer.kind()) {
                case RESPOND -> {
                    if (!confirmationQueue.respond(request.requestId(), answer.response())) {
                        out.println(NO_LONGER_PENDING);
                    }
                    return;
                }
                case CANCEL -> {
                    if (!confirmationQueue.cancel(request.requestId())) {
                        out.println(NO_LONGER_PENDING);
                    }
                    return;
                }
                case RETRY -> out.println("Please answer y, a, n [reason], r <instructions> or esc.");
            }
        }
    }

    static Answer parseAnswer(String line, boolean persistentOptionAvailable) {
        if (line == null) return Answer.CANCEL;
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("esc") || trimmed.equals("\u001b")) {
            return Answer.CANCEL;
        }

        int space = trimmed.indexOf(' ');
        String command = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
        String rest = space < 0 ? "" : trimmed.substring(space + 1).strip();

        return switch (command) {
            case "y", "yes" -> rest.isEmpty() ? Answer.respond(ConfirmationResponse.allowOnce()) : Answer.RETRY;
            case "a", "always" -> rest.isEmpty() && persistentOptionAvailable
                    ? Answer.respond(ConfirmationResponse.allowAlways())
                    : Answer.RETRY;
            case "n", "no" -> Answer.respond(ConfirmationResponse.deny(rest.isEmpty() ? null : rest));
            case "r", "redirect" -> rest.isEmpty() ? Answer.RETRY : Answer.respond(ConfirmationResponse.redirect(rest));
            default -> Answer.RETRY;
        };
    }

    private boolean stillShowing(ConfirmationRequestDto request) {
        return confirmationQueue.current()
                .map(shown -> shown.requestId().equals(request.requestId()))
                .orElse(false);
    }

    private String render(ConfirmationRequestDto request) {
        if (request.toolInput() == null) return "";
        try {
            return objectMapper.writeValueAsString(request.toolInput());
        } catch (JsonProcessingException e) {
            return request.toolInput().toString();
        }
    }
}
