package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.NodeArena;
import info.isaksson.erland.constructtiers.ir.NodeKind;
import info.isaksson.erland.constructtiers.rules.DefaultRuleSet;
import info.isaksson.erland.constructtiers.rules.RuleTable;
import info.isaksson.erland.constructtiers.rules.Tier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClassifierEngineTest {

    private final ClassifierEngine engine = new ClassifierEngine(DefaultRuleSet.table());

    @Test
    void binaryComparisonIsCore() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.binaryComparison());
        ClassifiedNode compare = find(tree, NodeKind.COMPARE);

        assertEquals(Tier.CORE, compare.ownTier);
        assertEquals(DefaultRuleSet.BINARY_COMPARISON, compare.ruleId());
        assertEquals(Tier.CORE, tree.aggregateTier());
    }

    @Test
    void chainedComparisonIsOverriddenToNative() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.chainedComparison());
        ClassifiedNode compare = find(tree, NodeKind.COMPARE);

        assertEquals(Tier.NATIVE, compare.ownTier);
        assertEquals(DefaultRuleSet.CHAINED_COMPARISON, compare.ruleId());
        assertTrue(compare.rationale().startsWith("chained comparison"), compare.rationale());
        assertEquals(Tier.NATIVE, tree.aggregateTier());
    }

    @Test
    void comprehensionIsExtendedStandalone() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.comprehension());
        ClassifiedNode comp = find(tree, NodeKind.COMPREHENSION);

        assertEquals(Tier.EXTENDED, comp.ownTier);
        assertEquals(Tier.EXTENDED, comp.effectiveTier);
        assertEquals(Tier.EXTENDED, tree.aggregateTier());
    }

    @Test
    void comprehensionEscalatesSurroundingArithmetic() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.arithmeticAroundComprehension());
        List<ClassifiedNode> ops = findAll(tree, NodeKind.BINARY_OP);
        ClassifiedNode product = ops.get(ops.size() - 1);

        assertEquals("*", product.node.attribute("op"));
        assertEquals(Tier.CORE, product.ownTier);
        assertEquals(Tier.EXTENDED, product.effectiveTier);
        assertTrue(product.isEscalated());

        List<ClassifiedNode> path = tree.escalationPath();
        ClassifiedNode origin = path.get(path.size() - 1);
        assertEquals(NodeKind.COMPREHENSION, origin.node.kind());
        assertFalse(origin.isEscalated());
    }

    @Test
    void plainArithmeticStaysCore() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.arithmetic());
        for (ClassifiedNode c : tree.nodes) {
            assertEquals(Tier.CORE, c.ownTier, c.toString());
            assertEquals(Tier.CORE, c.effectiveTier, c.toString());
        }
        assertTrue(tree.warnings.isEmpty());
    }

    @Test
    void decoratorsAreNativeWithAndWithoutArguments() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.decorators());
        List<ClassifiedNode> decorators = findAll(tree, NodeKind.DECORATOR);
        assertEquals(2, decorators.size());

        ClassifiedNode bare = decorators.get(0);
        ClassifiedNode withArgs = decorators.get(1);
        assertEquals(Tier.NATIVE, bare.ownTier);
        assertEquals(DefaultRuleSet.DECORATOR, bare.ruleId());
        assertEquals(Tier.NATIVE, withArgs.ownTier);
        assertEquals(DefaultRuleSet.DECORATOR_WITH_ARGUMENTS, withArgs.ruleId());
        assertNotEquals(bare.rationale(), withArgs.rationale());

        for (ClassifiedNode fn : findAll(tree, NodeKind.FUNCTION_DEF)) {
            assertEquals(Tier.EXTENDED, fn.ownTier);
            assertEquals(Tier.NATIVE, fn.effectiveTier);
        }
    }

    @Test
    void decoratorArgumentTextIsReadAsPresence() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.decoratorsWithArgumentText());
        List<ClassifiedNode> decorators = findAll(tree, NodeKind.DECORATOR);

        assertEquals(DefaultRuleSet.DECORATOR_WITH_ARGUMENTS, decorators.get(0).ruleId());
        assertEquals(Tier.NATIVE, decorators.get(0).ownTier);
        assertEquals(DefaultRuleSet.DECORATOR, decorators.get(1).ruleId());
        assertEquals(Tier.NATIVE, tree.aggregateTier());
    }

    @Test
    void distinctVariablesAreCollected() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.assignments("core/vars.py", "total", "count", "total"));
        assertEquals(List.of("count", "total"), tree.variables);
    }

    @Test
    void suspensionConstructsAreNativeRegardlessOfChildren() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.asyncWrappingArithmetic());
        ClassifiedNode fn = find(tree, NodeKind.ASYNC_FUNCTION_DEF);

        assertEquals(Tier.NATIVE, fn.ownTier);
        assertFalse(fn.isEscalated());
        assertEquals(Tier.CORE, find(tree, NodeKind.RETURN).effectiveTier);
        assertEquals(Tier.NATIVE, tree.aggregateTier());

        ClassifiedTree fetch = engine.classify(Fixtures.asyncFetch());
        assertEquals(Tier.NATIVE, find(fetch, NodeKind.AWAIT).ownTier);
        assertEquals(Tier.CORE, find(fetch, NodeKind.CALL).ownTier);
        assertEquals(Tier.NATIVE, find(fetch, NodeKind.ASSIGN).effectiveTier);
    }

    @Test
    void classBaseCountDecidesTier() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.classes());
        List<ClassifiedNode> classes = findAll(tree, NodeKind.CLASS_DEF);

        assertEquals(Tier.EXTENDED, classes.get(0).ownTier);
        assertEquals("class-def.single-base", classes.get(0).ruleId());
        assertEquals(Tier.NATIVE, classes.get(1).ownTier);
        assertEquals("class-def.multiple-bases", classes.get(1).ruleId());
    }

    @Test
    void exceptionHandlingIsExtended() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.tryExcept());
        assertEquals(Tier.EXTENDED, find(tree, NodeKind.TRY).ownTier);
        assertEquals(Tier.EXTENDED, find(tree, NodeKind.EXCEPT_HANDLER).ownTier);
        assertEquals(Tier.EXTENDED, tree.aggregateTier());
    }

    @Test
    void everyNodeGetsOneTierAndTiersOnlyEscalate() throws Exception {
        RuleTable table = DefaultRuleSet.table();
        List<NodeArena> all = List.of(
                Fixtures.binaryComparison(), Fixtures.chainedComparison(), Fixtures.comprehension(),
                Fixtures.arithmeticAroundComprehension(), Fixtures.decorators(), Fixtures.asyncFetch(),
                Fixtures.classes(), Fixtures.tryExcept());
        for (NodeArena arena : all) {
            ClassifiedTree tree = engine.classify(arena);
            assertEquals(arena.size(), tree.nodes.size());
            for (ClassifiedNode c : tree.nodes) {
                assertNotNull(c.ownTier);
                assertNotNull(c.effectiveTier);
                assertTrue(table.tierOrder().compare(c.effectiveTier, c.ownTier) >= 0);
                for (Integer child : c.node.children) {
                    assertTrue(table.tierOrder().compare(c.effectiveTier, tree.node(child).effectiveTier) >= 0,
                            arena.file + ": " + c + " below child " + tree.node(child));
                }
            }
        }
    }

    @Test
    void classificationIsDeterministic() throws Exception {
        ClassifiedTree a = engine.classify(Fixtures.decorators());
        ClassifiedTree b = engine.classify(Fixtures.decorators());
        for (int i = 0; i < a.nodes.size(); i++) {
            assertEquals(a.node(i).ownTier, b.node(i).ownTier);
            assertEquals(a.node(i).effectiveTier, b.node(i).effectiveTier);
            assertEquals(a.node(i).ruleId(), b.node(i).ruleId());
            assertEquals(a.node(i).escalatedBy, b.node(i).escalatedBy);
        }
        assertEquals(a.warnings, b.warnings);
    }

    @Test
    void standardModeWarnsAboutNativeConstructs() throws Exception {
        ClassifiedTree tree = engine.classify(Fixtures.chainedComparison());
        assertEquals(1, tree.warnings.size());
        ClassificationWarning w = tree.warnings.get(0);
        assertEquals(ClassificationWarning.NATIVE_CONSTRUCTS_PRESENT, w.code);
        assertEquals("1", w.context.get("count"));
    }

    static ClassifiedNode find(ClassifiedTree tree, NodeKind kind) {
        List<ClassifiedNode> all = findAll(tree, kind);
        assertFalse(all.isEmpty(), "no " + kind + " in " + tree.file());
        return all.get(0);
    }

    static List<ClassifiedNode> findAll(ClassifiedTree tree, NodeKind kind) {
        return tree.nodes.stream().filter(c -> c.node.kind() == kind).toList();
    }
}
