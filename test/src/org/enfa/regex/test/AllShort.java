/* @LICENSE@
 */


package org.enfa.regex.test;

import org.enfa.regex.AutomatonTestCase;
import org.enfa.regex.GraphvizRendererTestCase;
import org.enfa.regex.MainTestCase;
import org.enfa.regex.RegexParserTestCase;
import org.enfa.regex.SimulatorTestCase;
import org.enfa.regex.ThompsonTestCase;

import junit.framework.Test;
import junit.framework.TestSuite;

public class AllShort {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AllShort.suite());
    }

    public static Test suite() {
        TestSuite suite = new TestSuite("Short test suite.");
        //$JUnit-BEGIN$
        suite.addTestSuite(AutomatonTestCase.class);
        suite.addTestSuite(ThompsonTestCase.class);
        suite.addTestSuite(RegexParserTestCase.class);
        suite.addTestSuite(SimulatorTestCase.class);
        suite.addTestSuite(NfaTestCase.class);
        suite.addTestSuite(AlphabetTestCase.class);
        suite.addTestSuite(GraphvizRendererTestCase.class);
        suite.addTestSuite(MainTestCase.class);
        //$JUnit-END$
        return suite;
    }

}
