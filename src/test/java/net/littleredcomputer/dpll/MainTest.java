package net.littleredcomputer.dpll;

import org.junit.Test;

import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertThat;

public class MainTest {
    private final SATProblem p = SATProblem.parseFrom("p cnf 2 2\n1 2 0\n-1 0\n");

    @Test
    public void satisfyingModelPasses() {
        Main.checkModel(p, new int[]{-1, 2});
    }

    @Test(expected = IllegalStateException.class)
    public void falsifyingModelFails() {
        Main.checkModel(p, new int[]{1, -2});
    }

    @Test
    public void modeHelpListsOptionNames() {
        String help = Main.options().getOption("mode").getDescription();
        assertThat(help, containsString("eq"));
        assertThat(help, containsString("left_to_right"));
    }
}
