package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.domain.HandScore;
import cn.pianzi.holdem.core.domain.Pot;
import cn.pianzi.holdem.core.snapshot.PotAward;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PotManagerTest {
    @Test
    void shouldBuildMainAndSidePotsFromAllInTiers() {
        List<PlayerState> players = players(3);
        contribute(players.get(0), 100);
        contribute(players.get(1), 300);
        contribute(players.get(2), 500);

        List<Pot> pots = PotManager.computePots(players);

        assertEquals(List.of(
                new Pot(300, List.of(0, 1, 2)),
                new Pot(400, List.of(1, 2)),
                new Pot(200, List.of(2))
        ), pots);
    }

    @Test
    void shouldKeepFoldedChipsInThePots() {
        List<PlayerState> players = players(4);
        contribute(players.get(0), 100);
        contribute(players.get(1), 300);
        contribute(players.get(2), 300);
        contribute(players.get(3), 200);
        players.get(3).folded = true;

        List<Pot> pots = PotManager.computePots(players);

        assertEquals(List.of(
                new Pot(400, List.of(0, 1, 2)),
                new Pot(500, List.of(1, 2))
        ), pots);
        assertEquals(900, pots.stream().mapToInt(Pot::amount).sum());
    }

    @Test
    void shouldNestEligibilityByTier() {
        List<PlayerState> players = players(4);
        contribute(players.get(0), 50);
        contribute(players.get(1), 120);
        contribute(players.get(2), 400);
        contribute(players.get(3), 400);

        List<Pot> pots = PotManager.computePots(players);

        for (int i = 1; i < pots.size(); i++) {
            assertTrue(pots.get(i - 1).eligibleSeats().containsAll(pots.get(i).eligibleSeats()));
        }
    }

    @Test
    void shouldGiveOddChipToFirstWinnerLeftOfDealer() {
        List<PlayerState> players = players(6);
        TurnOrder order = new TurnOrder(players);

        List<PotAward> awards = PotManager.distribute(
                List.of(new Pot(301, List.of(2, 4, 5))),
                seat -> new HandScore(10, "tie"),
                order,
                1
        );

        PotAward award = awards.get(0);
        assertEquals(List.of(2, 4, 5), award.winners());
        assertEquals(101, award.payoutTo(2));
        assertEquals(100, award.payoutTo(4));
        assertEquals(100, award.payoutTo(5));
    }

    @Test
    void shouldWrapRemainderOrderAroundTheButton() {
        List<PlayerState> players = players(6);
        TurnOrder order = new TurnOrder(players);

        PotAward award = PotManager.distribute(
                List.of(new Pot(201, List.of(2, 5))),
                seat -> new HandScore(3, "tie"),
                order,
                4
        ).get(0);

        assertEquals(List.of(5, 2), award.winners());
        assertEquals(Map.of(5, 101, 2, 100), award.payouts());
    }

    @Test
    void shouldPayBestScoreOnly() {
        List<PlayerState> players = players(3);
        TurnOrder order = new TurnOrder(players);

        PotAward award = PotManager.distribute(
                List.of(new Pot(90, List.of(0, 1, 2))),
                seat -> new HandScore(seat == 1 ? 1 : 5, "seat " + seat),
                order,
                0
        ).get(0);

        assertEquals(List.of(1), award.winners());
        assertEquals(90, award.payoutTo(1));
    }

    @Test
    void shouldAwardSingleEligiblePotWithoutEvaluating() {
        List<PlayerState> players = players(3);
        TurnOrder order = new TurnOrder(players);
        List<Integer> evaluated = new ArrayList<>();

        List<PotAward> awards = PotManager.distribute(
                List.of(new Pot(300, List.of(0, 1)), new Pot(200, List.of(1))),
                seat -> {
                    evaluated.add(seat);
                    return new HandScore(seat, "seat " + seat);
                },
                order,
                2
        );

        assertEquals(300, awards.get(0).payoutTo(0));
        assertEquals(200, awards.get(1).payoutTo(1));
        assertEquals(List.of(0, 1), evaluated);
    }

    private static List<PlayerState> players(int count) {
        List<PlayerState> players = new ArrayList<>();
        for (int seat = 0; seat < count; seat++) {
            PlayerState player = new PlayerState(seat, "p" + seat, 1000);
            player.resetForHand();
            players.add(player);
        }
        return players;
    }

    private static void contribute(PlayerState player, int chips) {
        player.commit(chips);
    }
}
