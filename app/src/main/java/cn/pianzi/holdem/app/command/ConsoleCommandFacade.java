package cn.pianzi.holdem.app.command;

import cn.pianzi.holdem.app.application.TournamentApplicationService;
import cn.pianzi.holdem.app.presentation.EventSeverity;
import cn.pianzi.holdem.app.presentation.UserFacingEvent;
import cn.pianzi.holdem.app.util.ExceptionUtils;
import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.snapshot.GameSnapshot;
import cn.pianzi.holdem.core.snapshot.PlayerSnapshot;
import cn.pianzi.holdem.core.snapshot.SeatView;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Text front end for the human seat: {@code fold}, {@code check}, {@code call},
 * {@code raise <to>}, {@code pause [reason]}, {@code resume} and {@code status}.
 */
public final class ConsoleCommandFacade {
    private final TournamentApplicationService service;

    public ConsoleCommandFacade(TournamentApplicationService service) {
        this.service = Objects.requireNonNull(service, "service");
    }

    public CompletionStage<CommandOutcome> execute(String line) {
        if (line == null || line.isBlank()) {
            return CompletableFuture.completedFuture(CommandOutcome.failure("command.empty"));
        }
        String[] parts = line.trim().split("\\s+");
        String verb = parts[0].toLowerCase(Locale.ROOT);
        return switch (verb) {
            case "fold" -> fold();
            case "check" -> check();
            case "call" -> call();
            case "raise" -> parts.length < 2
                    ? CompletableFuture.completedFuture(CommandOutcome.failure("command.raise_amount_required"))
                    : raise(parts[1]);
            case "pause" -> pause(parts.length < 2 ? "" : line.trim().substring(parts[0].length()).trim());
            case "resume" -> resume();
            case "status" -> status();
            default -> CompletableFuture.completedFuture(CommandOutcome.failure("command.unknown: " + verb));
        };
    }

    public CompletionStage<CommandOutcome> fold() {
        return run("command.result.folded", () -> service.act(Decision.fold()));
    }

    public CompletionStage<CommandOutcome> check() {
        return run("command.result.checked", () -> service.act(Decision.check()));
    }

    public CompletionStage<CommandOutcome> call() {
        return run("command.result.called", () -> service.act(Decision.call()));
    }

    public CompletionStage<CommandOutcome> raise(String amount) {
        int raiseTo;
        try {
            raiseTo = Integer.parseInt(amount);
        } catch (NumberFormatException ex) {
            return CompletableFuture.completedFuture(CommandOutcome.failure("command.invalid_amount: " + amount));
        }
        return run("command.result.raised", () -> service.act(Decision.raiseTo(raiseTo)));
    }

    public CompletionStage<CommandOutcome> pause(String reason) {
        return run("command.result.paused", () -> service.pause(reason));
    }

    public CompletionStage<CommandOutcome> resume() {
        return run("command.result.resumed", service::resume);
    }

    public CompletionStage<CommandOutcome> status() {
        try {
            return service.snapshot().handle((snapshot, ex) -> {
                if (ex == null) {
                    return CommandOutcome.success("command.result.status", List.of(statusEvent(snapshot, service.pendingPrompt())));
                }
                return CommandOutcome.failure(ExceptionUtils.rootMessage(ex));
            });
        } catch (Exception ex) {
            return CompletableFuture.completedFuture(CommandOutcome.failure(ExceptionUtils.rootMessage(ex)));
        }
    }

    private CompletionStage<CommandOutcome> run(String successMessage, EventSupplier supplier) {
        try {
            return supplier.get().handle((events, ex) -> {
                if (ex == null) {
                    return CommandOutcome.success(successMessage, events);
                }
                return CommandOutcome.failure(ExceptionUtils.rootMessage(ex));
            });
        } catch (Exception ex) {
            return CompletableFuture.completedFuture(CommandOutcome.failure(ExceptionUtils.rootMessage(ex)));
        }
    }

    private static UserFacingEvent statusEvent(GameSnapshot snapshot, Optional<SeatView> prompt) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("gameId", snapshot.gameId());
        data.put("status", snapshot.status().name());
        data.put("phase", snapshot.phase().name());
        data.put("handNumber", snapshot.handNumber());
        data.put("blinds", snapshot.smallBlind() + "/" + snapshot.bigBlind());
        data.put("pot", snapshot.potTotal());
        data.put("board", snapshot.communityCards().stream().map(Object::toString).toList());
        List<String> stacks = new ArrayList<>(snapshot.players().size());
        for (PlayerSnapshot player : snapshot.players()) {
            stacks.add(player.seat() + ":" + player.name() + "=" + player.stack()
                    + (player.eliminated() ? " out" : player.folded() ? " folded" : ""));
        }
        data.put("stacks", stacks);
        if (snapshot.currentActor().isPresent()) {
            data.put("actor", snapshot.currentActor().getAsInt());
        }
        prompt.ifPresent(view -> {
            data.put("hand", view.holeCards().stream().map(Object::toString).toList());
            data.put("legalActions", view.legalActions().stream().map(Enum::name).sorted().toList());
            data.put("callAmount", view.callAmount());
            if (view.canRaise()) {
                data.put("raiseRange", view.minRaiseTo() + ".." + view.maxRaiseTo());
            }
        });
        return UserFacingEvent.broadcast(EventSeverity.INFO, "status.snapshot", "STATUS", data);
    }

    @FunctionalInterface
    private interface EventSupplier {
        CompletionStage<List<UserFacingEvent>> get();
    }
}
