package com.yhy.cutplan.cut.service;

import com.yhy.cutplan.cut.vo.CutRequest;
import com.yhy.cutplan.cut.vo.Pattern;
import com.yhy.cutplan.cut.vo.PatternItem;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.yhy.cutplan.cut.service.JobFixtures.piece;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PatternGeneratorTest {

    private final PatternGenerator generator = new PatternGenerator(200_000);

    @Test
    void bestPatternFillsStockCompletely() {
        DemandSnapshot demand = DemandSnapshot.of(List.of(piece(30, 3), piece(40, 1)));

        Pattern best = generator.best(100, 0, demand).orElseThrow();

        assertEquals(List.of(40.0, 30.0, 30.0), lengths(best));
        assertEquals(0.0, best.getWaste(), 1e-9);
        assertEquals(3, best.getPieceCount());
    }

    @Test
    void patternsComeInDecreasingUtilizedLength() {
        DemandSnapshot demand = DemandSnapshot.of(List.of(piece(30, 3), piece(40, 1), piece(15, 2)));

        List<Pattern> patterns = generator.generate(100, 1, demand);

        assertFalse(patterns.isEmpty());
        for (int i = 1; i < patterns.size(); i++) {
            assertTrue(patterns.get(i - 1).getUsedLength() >= patterns.get(i).getUsedLength() - 1e-6,
                    "pattern " + i + " is longer than its predecessor");
        }
        assertEquals(generator.best(100, 1, demand).orElseThrow(), patterns.get(0));
    }

    @Test
    void everyPatternIsFeasibleAndWithinDemand() {
        List<CutRequest> requests = List.of(piece(30, 3), piece(40, 1), piece(15, 2));
        DemandSnapshot demand = DemandSnapshot.of(requests);

        for (Pattern p : generator.generate(100, 2, demand)) {
            assertTrue(p.getPieceCount() > 0);
            assertTrue(p.getUsedLength() <= 100 + 1e-9, "pattern overflows stock: " + p);
            for (PatternItem item : p.getItems()) {
                assertTrue(item.getQuantity() <= requests.get(item.getRequestIndex()).getQuantity());
            }
        }
    }

    @Test
    void kerfIsChargedBetweenPiecesOnly() {
        DemandSnapshot exact = DemandSnapshot.of(List.of(piece(30, 3)));
        Pattern p = generator.best(100, 5, exact).orElseThrow();
        assertEquals(3, p.getPieceCount());
        assertEquals(10.0, p.getKerfLoss(), 1e-9);
        assertEquals(0.0, p.getWaste(), 1e-9);

        DemandSnapshot tight = DemandSnapshot.of(List.of(piece(25, 2)));
        Pattern single = generator.best(50, 2, tight).orElseThrow();
        assertEquals(1, single.getPieceCount());
        assertEquals(0.0, single.getKerfLoss(), 1e-9);
        assertEquals(25.0, single.getWaste(), 1e-9);
    }

    @Test
    void equalUtilizationPrefersMoreOfTheLongerPiece() {
        DemandSnapshot demand = DemandSnapshot.of(List.of(piece(5, 2), piece(6, 1), piece(4, 1)));

        List<Pattern> patterns = generator.generate(10, 0, demand);

        assertEquals(List.of(6.0, 4.0), lengths(patterns.get(0)));
        assertEquals(List.of(5.0, 5.0), lengths(patterns.get(1)));
    }

    @Test
    void pieceLongerThanStockYieldsNothing() {
        DemandSnapshot demand = DemandSnapshot.of(List.of(piece(120, 1)));

        assertTrue(generator.generate(100, 0, demand).isEmpty());
        assertEquals(Optional.empty(), generator.best(100, 0, demand));
    }

    @Test
    void ceilingFallsBackToGreedyFill() {
        PatternGenerator capped = new PatternGenerator(1);
        DemandSnapshot demand = DemandSnapshot.of(List.of(piece(30, 3), piece(40, 1)));

        Pattern best = capped.best(100, 0, demand).orElseThrow();
        assertEquals(List.of(40.0), lengths(best));

        List<Pattern> patterns = capped.generate(100, 0, demand);
        assertThat(patterns).contains(best);
    }

    @Test
    void greedyFillRepeatsLongestPieceThatFits() {
        PatternGenerator capped = new PatternGenerator(1);
        DemandSnapshot demand = DemandSnapshot.of(List.of(piece(120, 1), piece(30, 5)));

        Pattern best = capped.best(100, 0, demand).orElseThrow();

        assertEquals(List.of(30.0, 30.0, 30.0), lengths(best));
    }

    @Test
    void sameLengthIsSharedAcrossRequestsInOrder() {
        DemandSnapshot demand = DemandSnapshot.of(List.of(piece(30, 2, "A"), piece(30, 1, "B")));

        Pattern best = generator.best(100, 0, demand).orElseThrow();

        assertEquals(2, best.getItems().size());
        assertEquals("A", best.getItems().get(0).getLabel());
        assertEquals(2, best.getItems().get(0).getQuantity());
        assertEquals("B", best.getItems().get(1).getLabel());
        assertEquals(1, best.getItems().get(1).getQuantity());
    }

    @Test
    void remainingDemandBoundsMultiplicity() {
        List<CutRequest> requests = List.of(piece(10, 5), piece(20, 3));
        DemandSnapshot demand = DemandSnapshot.of(requests, new int[]{1, 0});

        List<Pattern> patterns = generator.generate(100, 0, demand);

        assertEquals(1, patterns.size());
        assertEquals(List.of(10.0), lengths(patterns.get(0)));
    }

    @Test
    void repeatedCallsAreIdentical() {
        DemandSnapshot demand = DemandSnapshot.of(List.of(piece(23, 4), piece(17, 5), piece(41, 2)));

        assertEquals(generator.generate(120, 1.5, demand), generator.generate(120, 1.5, demand));
    }

    private static List<Double> lengths(Pattern p) {
        return p.getItems().stream()
                .flatMap(i -> java.util.Collections.nCopies(i.getQuantity(), i.getLength()).stream())
                .collect(Collectors.toList());
    }
}
