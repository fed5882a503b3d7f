package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.config.BlindLevel;
import cn.pianzi.holdem.core.config.TournamentConfig;
import cn.pianzi.holdem.core.domain.Action;
import cn.pianzi.holdem.core.domain.ActionType;
import cn.pianzi.holdem.core.domain.Card;
import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.domain.GamePhase;
import cn.pianzi.holdem.core.domain.HandScore;
import cn.pianzi.holdem.core.domain.Pot;
import cn.pianzi.holdem.core.domain.TournamentMode;
import cn.pianzi.holdem.core.domain.TournamentStatus;
import cn.pianzi.holdem.core.event.CoreEvent;
import cn.pianzi.holdem.core.event.CoreEventType;
import cn.pianzi.holdem.core.port.HandEvaluator;
import cn.pianzi.holdem.core.port.RandomSource;
import cn.pianzi.holdem.core.snapshot.GameSnapshot;
import cn.pianzi.holdem.core.snapshot.HandParticipant;
import cn.pianzi.holdem.core.snapshot.HandRecord;
import cn.pianzi.holdem.core.snapshot.HandResult;
import cn.pianzi.holdem.core.snapshot.PlayerSnapshot;
import cn.pianzi.holdem.core.snapshot.PotAward;
import cn.pianzi.holdem.core.snapshot.SeatScore;
import cn.pianzi.holdem.core.snapshot.SeatView;
import cn.pianzi.holdem.core.snapshot.Standing;
import cn.pianzi.holdem.core.snapshot.TournamentResult;
import cn.pianzi.holdem.core.snapshot.TournamentStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Synchronous sit-and-go state machine. Every mutating method returns the events it
 * produced; callers serialize access (see the runtime package). Rejected commands throw
 * {@link InvalidActionException} before anything is changed.
 */
public final class TournamentEngine {
    private static final Logger log = LoggerFactory.getLogger(TournamentEngine.class);

    /** Seat that belongs to the human in {@link TournamentMode#PLAYER} games. */
    public static final int HUMAN_SEAT = 0;

    private final String gameId;
    private final TournamentConfig config;
    private final TournamentMode mode;
    private final RandomSource random;
    private final HandEvaluator evaluator;
    private final BlindSchedule blindSchedule;
    private final List<PlayerState> players;
    private final TurnOrder turnOrder;
    private final StatsTracker stats;
    private final List<Integer> eliminationOrder;
    private final List<Card> communityCards;
    private final List<Action> actions;
    private final Map<Integer, HandScore> scoreCache;

    private int totalChips;
    private TournamentStatus status;
    private GamePhase phase;
    private int dealerSeat;
    private int smallBlindSeat;
    private int bigBlindSeat;
    private int handNumber;
    private int handsPlayed;
    private int blindLevel;
    private BlindLevel blinds;
    private Deck deck;
    private List<Card> deckOrder;
    private BettingRound betting;
    private int currentActor;
    private long actionSequence;
    private HandResult lastResult;
    private HandRecord lastHandRecord;
    private TournamentResult result;

    public TournamentEngine(String gameId, List<String> seatNames) {
        this(gameId, TournamentConfig.defaults(), TournamentMode.SPECTATOR, seatNames,
                RandomSource.threadLocal(), (hole, board) -> {
                    throw new IllegalStateException("no hand evaluator configured");
                });
    }

    public TournamentEngine(
            String gameId,
            TournamentConfig config,
            TournamentMode mode,
            List<String> seatNames,
            RandomSource random,
            HandEvaluator evaluator
    ) {
        this.gameId = Objects.requireNonNull(gameId, "gameId");
        this.config = Objects.requireNonNull(config, "config");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.random = Objects.requireNonNull(random, "random");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        Objects.requireNonNull(seatNames, "seatNames");
        if (seatNames.size() < config.minSeats() || seatNames.size() > config.maxSeats()) {
            throw new IllegalArgumentException("seat count must be in [" + config.minSeats() + ", " + config.maxSeats() + "]");
        }
        this.blindSchedule = BlindSchedule.from(config);
        this.players = new ArrayList<>(seatNames.size());
        for (int seat = 0; seat < seatNames.size(); seat++) {
            players.add(new PlayerState(seat, Objects.requireNonNull(seatNames.get(seat), "seat name"), config.startingStack()));
        }
        this.turnOrder = new TurnOrder(players);
        this.stats = new StatsTracker();
        this.eliminationOrder = new ArrayList<>();
        this.communityCards = new ArrayList<>(5);
        this.actions = new ArrayList<>();
        this.scoreCache = new HashMap<>();
        this.totalChips = config.startingStack() * seatNames.size();
        this.status = TournamentStatus.WAITING;
        this.phase = GamePhase.BETWEEN_HANDS;
        this.dealerSeat = -1;
        this.smallBlindSeat = -1;
        this.bigBlindSeat = -1;
        this.currentActor = -1;
        this.blindLevel = 0;
        this.blinds = blindSchedule.level(0);
    }

    public List<CoreEvent> startTournament() {
        if (status != TournamentStatus.WAITING) {
            throw new IllegalStateException("tournament_already_started");
        }
        status = TournamentStatus.ACTIVE;
        stats.started(Instant.now());
        dealerSeat = random.nextIntInclusive(0, players.size() - 1);
        log.info("Tournament {} started: {} seats, {} chips each, button on seat {}",
                gameId, players.size(), config.startingStack(), dealerSeat);
        return List.of(CoreEvent.of(
                CoreEventType.TOURNAMENT_STARTED,
                "tournament started",
                Map.of(
                        "gameId", gameId,
                        "seats", players.size(),
                        "startingStack", config.startingStack(),
                        "dealerSeat", dealerSeat,
                        "mode", mode.name()
                )
        ));
    }

    public List<CoreEvent> startHand() {
        ensureActive();
        if (phase != GamePhase.BETWEEN_HANDS) {
            throw new InvalidActionException("hand_in_progress", "phase " + phase);
        }
        if (turnOrder.liveCount() < 2) {
            throw new IllegalStateException("not_enough_players");
        }
        int dealer = handNumber == 0 ? dealerSeat : turnOrder.nextLiveSeat(dealerSeat);
        int level = blindSchedule.levelFor(handsPlayed);
        return beginHand(Deck.shuffled(random), dealer, level, blindSchedule.level(level));
    }

    /**
     * Starts a hand from a known deck, button and blind level. Used directly when replaying
     * a recorded hand.
     */
    List<CoreEvent> beginHand(Deck handDeck, int dealer, int level, BlindLevel handBlinds) {
        if (!players.get(dealer).live()) {
            throw new InvariantViolationException("dealer seat " + dealer + " is eliminated");
        }
        List<CoreEvent> events = new ArrayList<>();
        handNumber++;
        for (PlayerState player : players) {
            player.resetForHand();
        }
        communityCards.clear();
        actions.clear();
        scoreCache.clear();
        actionSequence = 0;
        lastResult = null;
        deck = handDeck;
        deckOrder = handDeck.order();
        dealerSeat = dealer;
        blindLevel = level;
        blinds = handBlinds;
        smallBlindSeat = turnOrder.smallBlindSeat(dealer);
        bigBlindSeat = turnOrder.bigBlindSeat(dealer);
        betting = new BettingRound(handBlinds.bigBlind());
        phase = GamePhase.PRE_FLOP;

        log.info("Hand #{} of {} started: button {}, blinds {}/{}",
                handNumber, gameId, dealer, handBlinds.smallBlind(), handBlinds.bigBlind());
        events.add(CoreEvent.of(
                CoreEventType.HAND_STARTED,
                "hand started",
                Map.of(
                        "handNumber", handNumber,
                        "dealerSeat", dealer,
                        "smallBlindSeat", smallBlindSeat,
                        "bigBlindSeat", bigBlindSeat,
                        "smallBlind", handBlinds.smallBlind(),
                        "bigBlind", handBlinds.bigBlind(),
                        "blindLevel", level
                )
        ));

        postBlind(players.get(smallBlindSeat), handBlinds.smallBlind(), events);
        postBlind(players.get(bigBlindSeat), handBlinds.bigBlind(), events);

        List<PlayerState> order = turnOrder.dealingOrder(dealer);
        List<List<Card>> holeCards = deck.dealHoleCards(order.size());
        for (int i = 0; i < order.size(); i++) {
            PlayerState player = order.get(i);
            player.holeCards.addAll(holeCards.get(i));
            events.add(CoreEvent.of(
                    CoreEventType.HOLE_CARDS_DEALT,
                    "hole cards dealt",
                    Map.of("seat", player.seat, "cards", cardNames(player.holeCards))
            ));
        }

        int openingBet = 0;
        for (PlayerState player : players) {
            openingBet = Math.max(openingBet, player.currentBet);
        }
        betting.openStreet(openingBet);
        events.add(phaseChangedEvent());
        progress(events, turnOrder.streetAnchor(phase, dealerSeat, bigBlindSeat));
        verifyInvariants();
        return Collections.unmodifiableList(events);
    }

    public List<CoreEvent> applyAction(int seat, Decision decision) {
        Objects.requireNonNull(decision, "decision");
        ensureActive();
        if (!phase.isBettingStreet()) {
            throw new InvalidActionException("no_betting_in_progress", "phase " + phase);
        }
        if (seat != currentActor) {
            throw new InvalidActionException("not_current_actor", "seat " + seat + ", expected " + currentActor);
        }
        PlayerState player = players.get(seat);
        betting.validate(player, decision);

        List<CoreEvent> events = new ArrayList<>();
        BettingRound.Applied applied = betting.apply(player, decision, players);
        Action action = recordAction(player, decision.type(), applied.chips(), applied.allIn());
        stats.recordAction(decision.type(), applied.allIn());
        log.debug("Hand #{} seat {} {} {} (street total {}, stack {})",
                handNumber, seat, decision.type(), applied.chips(), applied.streetTotal(), player.stack);
        events.add(CoreEvent.of(
                CoreEventType.ACTION_APPLIED,
                "action applied",
                Map.of(
                        "seat", seat,
                        "action", decision.type().name(),
                        "amount", applied.chips(),
                        "streetTotal", action.raiseTo(),
                        "stack", player.stack,
                        "allIn", applied.allIn(),
                        "fullRaise", applied.fullRaise()
                )
        ));
        if (applied.allIn()) {
            events.add(allInEvent(player));
        }
        progress(events, seat);
        verifyInvariants();
        return Collections.unmodifiableList(events);
    }

    /** Check when legal, fold otherwise. */
    public Decision timeoutDecision(int seat) {
        return legalActions(seat).contains(ActionType.CHECK) ? Decision.check() : Decision.fold();
    }

    public List<CoreEvent> pause(String reason) {
        if (status != TournamentStatus.ACTIVE) {
            throw new InvalidActionException("cannot_pause", "status " + status);
        }
        status = TournamentStatus.PAUSED;
        log.info("Tournament {} paused ({})", gameId, reason);
        return List.of(CoreEvent.of(
                CoreEventType.GAME_PAUSED,
                "game paused",
                Map.of("reason", reason, "phase", phase.name(), "handNumber", handNumber)
        ));
    }

    public List<CoreEvent> resume() {
        if (status != TournamentStatus.PAUSED) {
            throw new InvalidActionException("not_paused", "status " + status);
        }
        status = TournamentStatus.ACTIVE;
        log.info("Tournament {} resumed", gameId);
        return List.of(CoreEvent.of(
                CoreEventType.GAME_RESUMED,
                "game resumed",
                Map.of("phase", phase.name(), "handNumber", handNumber)
        ));
    }

    /**
     * Terminates the tournament after an unrecoverable failure. Chips are left where they
     * were; standings are computed from current stacks.
     */
    public List<CoreEvent> abort(String reason) {
        Objects.requireNonNull(reason, "reason");
        if (status == TournamentStatus.COMPLETED) {
            return List.of();
        }
        List<Standing> finalStandings = standings();
        status = TournamentStatus.COMPLETED;
        phase = GamePhase.COMPLETED;
        currentActor = -1;
        stats.ended(Instant.now());
        result = new TournamentResult(gameId, -1, reason, finalStandings, stats.snapshot());
        return List.of(CoreEvent.of(
                CoreEventType.TOURNAMENT_ABORTED,
                "tournament aborted",
                Map.of("gameId", gameId, "reason", reason, "handNumber", handNumber)
        ));
    }

    public Set<ActionType> legalActions(int seat) {
        if (status != TournamentStatus.ACTIVE || seat != currentActor || betting == null) {
            return Set.of();
        }
        return betting.legalActions(players.get(seat));
    }

    public OptionalInt currentActor() {
        return currentActor < 0 ? OptionalInt.empty() : OptionalInt.of(currentActor);
    }

    /**
     * Redacted view for one seat: its own hole cards plus public information. Legal
     * actions are only filled in for the current actor.
     */
    public SeatView seatView(int seat) {
        PlayerState self = player(seat);
        Set<ActionType> legal = legalActions(seat);
        boolean acting = !legal.isEmpty();
        List<PlayerSnapshot> table = new ArrayList<>(players.size());
        for (PlayerState player : players) {
            table.add(playerSnapshot(player, player.seat == seat || revealed(player.seat)));
        }
        return new SeatView(
                gameId,
                seat,
                0L,
                handNumber,
                phase,
                dealerSeat,
                blinds.smallBlind(),
                blinds.bigBlind(),
                self.holeCards,
                communityCards,
                table,
                currentPots(),
                actions,
                betting == null ? 0 : betting.betToMatch(),
                legal,
                acting ? betting.callAmount(self) : 0,
                acting && legal.contains(ActionType.RAISE) ? betting.minRaiseTo(self) : 0,
                acting && legal.contains(ActionType.RAISE) ? betting.maxRaiseTo(self) : 0
        );
    }

    /**
     * Broadcast view. In spectator games every hole card is visible; in player games only
     * the human seat's cards and hands shown down are.
     */
    public GameSnapshot snapshot() {
        List<PlayerSnapshot> table = new ArrayList<>(players.size());
        for (PlayerState player : players) {
            boolean visible = mode == TournamentMode.SPECTATOR || player.seat == HUMAN_SEAT || revealed(player.seat);
            table.add(playerSnapshot(player, visible));
        }
        return new GameSnapshot(
                gameId,
                0L,
                status,
                mode,
                phase,
                handNumber,
                handsPlayed,
                dealerSeat,
                blindLevel,
                blinds.smallBlind(),
                blinds.bigBlind(),
                table,
                communityCards,
                currentPots(),
                betting == null ? 0 : betting.betToMatch(),
                currentActor(),
                -1,
                actions,
                Optional.ofNullable(lastResult),
                eliminationOrder
        );
    }

    public Optional<HandRecord> lastHandRecord() {
        return Optional.ofNullable(lastHandRecord);
    }

    public Optional<TournamentResult> result() {
        return Optional.ofNullable(result);
    }

    /**
     * Live players by chips, then eliminated players from last out to first out. While a hand
     * is open a live player's chips include what they have put into the pot.
     */
    public List<Standing> standings() {
        List<PlayerState> alive = new ArrayList<>();
        for (PlayerState player : players) {
            if (player.live()) {
                alive.add(player);
            }
        }
        boolean handOpen = phase.isBettingStreet();
        ToIntFunction<PlayerState> chips = p -> p.stack + (handOpen ? p.totalContributed : 0);
        alive.sort(Comparator.comparingInt(chips).reversed().thenComparingInt(p -> p.seat));
        List<Standing> standings = new ArrayList<>(players.size());
        int place = 1;
        for (PlayerState player : alive) {
            standings.add(new Standing(place++, player.seat, player.name, chips.applyAsInt(player), 0));
        }
        for (int i = eliminationOrder.size() - 1; i >= 0; i--) {
            PlayerState player = players.get(eliminationOrder.get(i));
            standings.add(new Standing(place++, player.seat, player.name, player.stack, player.eliminatedInHand));
        }
        return List.copyOf(standings);
    }

    public TournamentStats stats() {
        return stats.snapshot();
    }

    public String gameId() {
        return gameId;
    }

    public TournamentConfig config() {
        return config;
    }

    public TournamentMode mode() {
        return mode;
    }

    public TournamentStatus status() {
        return status;
    }

    public GamePhase phase() {
        return phase;
    }

    public int handNumber() {
        return handNumber;
    }

    public int handsPlayed() {
        return handsPlayed;
    }

    public int dealerSeat() {
        return dealerSeat;
    }

    public int seatCount() {
        return players.size();
    }

    public int stack(int seat) {
        return player(seat).stack;
    }

    public int totalChips() {
        return totalChips;
    }

    // Package-private hooks for replay.

    void restoreSeat(int seat, int stack, boolean eliminated) {
        PlayerState player = player(seat);
        player.stack = stack;
        player.eliminated = eliminated;
    }

    void restoreProgress(int completedHandNumber) {
        status = TournamentStatus.ACTIVE;
        handNumber = completedHandNumber;
        totalChips = chipsInPlay();
    }

    int chipsInPlay() {
        int total = 0;
        for (PlayerState player : players) {
            total += player.stack;
        }
        return total;
    }

    private void progress(List<CoreEvent> events, int anchor) {
        int searchFrom = anchor;
        while (true) {
            if (inHandCount() == 1) {
                finishHand(events, false);
                return;
            }
            if (!betting.isClosed(players)) {
                int next = turnOrder.nextSeat(searchFrom, betting::owesDecision);
                if (next < 0) {
                    throw new InvariantViolationException("betting round open without an actor");
                }
                currentActor = next;
                PlayerState actor = players.get(next);
                events.add(CoreEvent.of(
                        CoreEventType.TURN_CHANGED,
                        "turn changed",
                        Map.of(
                                "seat", next,
                                "phase", phase.name(),
                                "callAmount", betting.callAmount(actor),
                                "betToMatch", betting.betToMatch()
                        )
                ));
                return;
            }
            currentActor = -1;
            if (phase == GamePhase.RIVER) {
                finishHand(events, true);
                return;
            }
            advanceStreet(events);
            searchFrom = turnOrder.streetAnchor(phase, dealerSeat, bigBlindSeat);
        }
    }

    private void advanceStreet(List<CoreEvent> events) {
        for (PlayerState player : players) {
            player.resetForStreet();
        }
        phase = phase.nextStreet();
        List<Card> dealt = deck.dealCommunity(phase.communityCardsToDeal());
        communityCards.addAll(dealt);
        betting.openStreet(0);
        events.add(phaseChangedEvent());
        events.add(CoreEvent.of(
                CoreEventType.COMMUNITY_DEALT,
                "community cards dealt",
                Map.of(
                        "phase", phase.name(),
                        "cards", cardNames(dealt),
                        "board", cardNames(communityCards)
                )
        ));
    }

    private void finishHand(List<CoreEvent> events, boolean showdown) {
        currentActor = -1;
        List<Pot> pots = PotManager.computePots(players);
        int potTotal = 0;
        for (Pot pot : pots) {
            potTotal += pot.amount();
        }

        List<PotAward> awards;
        List<SeatScore> scores = new ArrayList<>();
        if (showdown) {
            phase = GamePhase.SHOWDOWN;
            events.add(phaseChangedEvent());
            for (PlayerState player : players) {
                if (player.inHand()) {
                    HandScore score = score(player.seat);
                    scores.add(new SeatScore(player.seat, player.holeCards, score.rank(), score.description()));
                }
            }
            awards = PotManager.distribute(pots, this::score, turnOrder, dealerSeat);
            List<Map<String, Object>> shown = new ArrayList<>();
            for (SeatScore score : scores) {
                shown.add(Map.of(
                        "seat", score.seat(),
                        "cards", cardNames(score.holeCards()),
                        "description", score.description()
                ));
            }
            events.add(CoreEvent.of(
                    CoreEventType.SHOWDOWN,
                    "showdown",
                    Map.of("handNumber", handNumber, "board", cardNames(communityCards), "hands", shown)
            ));
        } else {
            awards = PotManager.awardAll(pots, soleSurvivor());
        }

        for (PotAward award : awards) {
            for (Map.Entry<Integer, Integer> payout : award.payouts().entrySet()) {
                players.get(payout.getKey()).stack += payout.getValue();
            }
            events.add(CoreEvent.of(
                    CoreEventType.POT_AWARDED,
                    "pot awarded",
                    Map.of(
                            "potIndex", award.potIndex(),
                            "amount", award.amount(),
                            "winners", award.winners(),
                            "payouts", award.payouts(),
                            "showdown", showdown
                    )
            ));
        }
        stats.recordHand(handNumber, potTotal, showdown, scores);
        lastResult = new HandResult(handNumber, showdown, scores, awards);

        List<Integer> busted = eliminateBustedPlayers(events);
        lastHandRecord = buildRecord(pots, busted);
        if (!players.get(dealerSeat).live() && turnOrder.liveCount() > 0) {
            // the next hand still moves the button to the first live seat after the busted one
            dealerSeat = turnOrder.previousLiveSeat(dealerSeat);
        }
        handsPlayed++;
        phase = GamePhase.BETWEEN_HANDS;
        log.info("Hand #{} of {} completed: pot {}, {}", handNumber, gameId, potTotal,
                showdown ? "showdown" : "won without showdown");
        events.add(CoreEvent.of(
                CoreEventType.HAND_COMPLETED,
                "hand completed",
                Map.of("handNumber", handNumber, "potTotal", potTotal, "showdown", showdown, "eliminated", busted)
        ));

        if (turnOrder.liveCount() <= 1) {
            completeTournament(events);
            return;
        }
        int nextLevel = blindSchedule.levelFor(handsPlayed);
        if (nextLevel > blindLevel) {
            BlindLevel next = blindSchedule.level(nextLevel);
            log.info("Blinds of {} increase to {}/{} (level {})", gameId, next.smallBlind(), next.bigBlind(), nextLevel);
            events.add(CoreEvent.of(
                    CoreEventType.BLINDS_INCREASED,
                    "blinds increased",
                    Map.of("blindLevel", nextLevel, "smallBlind", next.smallBlind(), "bigBlind", next.bigBlind())
            ));
        }
    }

    private List<Integer> eliminateBustedPlayers(List<CoreEvent> events) {
        List<PlayerState> busted = new ArrayList<>();
        for (PlayerState player : players) {
            if (player.dealtIn && !player.eliminated && player.stack == 0) {
                busted.add(player);
            }
        }
        // the smaller starting stack went out first and finishes lower
        busted.sort(Comparator.comparingInt((PlayerState p) -> p.stackAtHandStart).thenComparingInt(p -> p.seat));
        List<Integer> seats = new ArrayList<>(busted.size());
        for (PlayerState player : busted) {
            player.eliminated = true;
            player.eliminatedInHand = handNumber;
            eliminationOrder.add(player.seat);
            seats.add(player.seat);
            int place = turnOrder.liveCount() + 1;
            log.info("Seat {} ({}) eliminated in hand #{}, finishing {}", player.seat, player.name, handNumber, place);
            events.add(CoreEvent.of(
                    CoreEventType.PLAYER_ELIMINATED,
                    "player eliminated",
                    Map.of("seat", player.seat, "name", player.name, "place", place, "handNumber", handNumber)
            ));
        }
        return List.copyOf(seats);
    }

    private void completeTournament(List<CoreEvent> events) {
        status = TournamentStatus.COMPLETED;
        phase = GamePhase.COMPLETED;
        stats.ended(Instant.now());
        int winner = turnOrder.nextLiveSeat(-1);
        result = new TournamentResult(gameId, winner, null, standings(), stats.snapshot());
        PlayerState champion = players.get(winner);
        log.info("Tournament {} completed after {} hands, winner seat {} ({})",
                gameId, handsPlayed, winner, champion.name);
        events.add(CoreEvent.of(
                CoreEventType.TOURNAMENT_COMPLETED,
                "tournament completed",
                Map.of("winnerSeat", winner, "winnerName", champion.name, "hands", handsPlayed)
        ));
    }

    private HandRecord buildRecord(List<Pot> pots, List<Integer> busted) {
        List<HandParticipant> participants = new ArrayList<>();
        for (PlayerState player : players) {
            if (player.dealtIn) {
                participants.add(new HandParticipant(
                        player.seat,
                        player.name,
                        player.stackAtHandStart,
                        player.stack,
                        player.totalContributed,
                        player.folded,
                        player.holeCards
                ));
            }
        }
        return new HandRecord(
                gameId,
                handNumber,
                players.size(),
                dealerSeat,
                smallBlindSeat,
                bigBlindSeat,
                blindLevel,
                blinds.smallBlind(),
                blinds.bigBlind(),
                participants,
                deckOrder,
                communityCards,
                actions,
                pots,
                lastResult,
                busted
        );
    }

    private void postBlind(PlayerState player, int nominal, List<CoreEvent> events) {
        int amount = BlindSchedule.postAmount(nominal, player.stack);
        player.commit(amount);
        recordAction(player, ActionType.POST_BLIND, amount, player.allIn);
        events.add(CoreEvent.of(
                CoreEventType.BLIND_POSTED,
                "blind posted",
                Map.of("seat", player.seat, "amount", amount, "nominal", nominal, "allIn", player.allIn)
        ));
        if (player.allIn) {
            stats.recordAction(ActionType.POST_BLIND, true);
            events.add(allInEvent(player));
        }
    }

    private Action recordAction(PlayerState player, ActionType type, int chips, boolean allIn) {
        Action action = new Action(++actionSequence, player.seat, type, chips, player.currentBet, phase, allIn);
        actions.add(action);
        return action;
    }

    private HandScore score(int seat) {
        return scoreCache.computeIfAbsent(seat, key -> {
            PlayerState player = players.get(key);
            return Objects.requireNonNull(evaluator.score(List.copyOf(player.holeCards), List.copyOf(communityCards)),
                    "hand evaluator returned null");
        });
    }

    private List<Pot> currentPots() {
        if (!phase.isBettingStreet()) {
            return List.of();
        }
        return PotManager.computePots(players);
    }

    private boolean revealed(int seat) {
        if (lastResult == null || !lastResult.showdown()) {
            return false;
        }
        for (SeatScore score : lastResult.scores()) {
            if (score.seat() == seat) {
                return true;
            }
        }
        return false;
    }

    private PlayerSnapshot playerSnapshot(PlayerState player, boolean withHoleCards) {
        return new PlayerSnapshot(
                player.seat,
                player.name,
                player.stack,
                player.currentBet,
                player.totalContributed,
                withHoleCards ? player.holeCards : List.of(),
                player.folded,
                player.allIn,
                player.eliminated,
                player.seat == dealerSeat
        );
    }

    private void verifyInvariants() {
        boolean handOpen = phase.isBettingStreet();
        long inPlay = 0;
        Set<Card> seen = new HashSet<>(communityCards);
        if (seen.size() != communityCards.size()) {
            throw new InvariantViolationException("duplicate community card");
        }
        for (PlayerState player : players) {
            if (player.stack < 0 || player.totalContributed < 0) {
                throw new InvariantViolationException("negative chips at seat " + player.seat);
            }
            if (handOpen) {
                if (player.stack + player.totalContributed != player.stackAtHandStart) {
                    throw new InvariantViolationException("chip conservation broken at seat " + player.seat);
                }
                inPlay += player.totalContributed;
                for (Card card : player.holeCards) {
                    if (!seen.add(card)) {
                        throw new InvariantViolationException("duplicate card " + card);
                    }
                }
            }
            inPlay += player.stack;
        }
        if (inPlay != totalChips) {
            throw new InvariantViolationException("chips in play " + inPlay + " != " + totalChips);
        }
        if (currentActor >= 0 && !players.get(currentActor).canAct()) {
            throw new InvariantViolationException("current actor " + currentActor + " cannot act");
        }
    }

    private void ensureActive() {
        switch (status) {
            case WAITING -> throw new InvalidActionException("tournament_not_started");
            case PAUSED -> throw new InvalidActionException("game_paused");
            case COMPLETED -> throw new InvalidActionException("tournament_completed");
            default -> {
            }
        }
    }

    private int inHandCount() {
        int count = 0;
        for (PlayerState player : players) {
            if (player.inHand()) {
                count++;
            }
        }
        return count;
    }

    private int soleSurvivor() {
        for (PlayerState player : players) {
            if (player.inHand()) {
                return player.seat;
            }
        }
        throw new InvariantViolationException("no player left in hand");
    }

    private PlayerState player(int seat) {
        if (seat < 0 || seat >= players.size()) {
            throw new InvalidActionException("unknown_seat", String.valueOf(seat));
        }
        return players.get(seat);
    }

    private CoreEvent phaseChangedEvent() {
        return CoreEvent.of(
                CoreEventType.PHASE_CHANGED,
                "phase changed",
                Map.of("phase", phase.name(), "handNumber", handNumber)
        );
    }

    private CoreEvent allInEvent(PlayerState player) {
        return CoreEvent.of(
                CoreEventType.ALL_IN,
                "player all in",
                Map.of("seat", player.seat, "name", player.name, "amount", player.totalContributed)
        );
    }

    private static List<String> cardNames(List<Card> cards) {
        List<String> names = new ArrayList<>(cards.size());
        for (Card card : cards) {
            names.add(card.shortName());
        }
        return List.copyOf(names);
    }
}
