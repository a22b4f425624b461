package com.vyperformatter.plugins.vyper.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.vyperformatter.plugins.vyper.parsing.ParseException;
import com.vyperformatter.plugins.vyper.parsing.Tokenizer;

class TreeFormatterTest {

    @Test
    void normalizesWhitespaceInInterfaceSignature() throws ParseException {
        String source = "interface ERC20:\n"
                + "    def transfer( _to   :address,_amount:uint256)   :    nonpayable\n";

        _assertFormatted("interface ERC20:\n"
                + "    def transfer(_to: address, _amount: uint256): nonpayable\n", source);
    }

    @Test
    void magicTrailingCommaExplodesCall() throws ParseException {
        String source = "@external\n"
                + "def foo():\n"
                + "    self.b(0, # amount\n"
                + "     msg.sender, # sender\n"
                + "     True, # refund\n"
                + "    )\n";

        _assertFormatted("@external\n"
                + "def foo():\n"
                + "    self.b(\n"
                + "        0,  # amount\n"
                + "        msg.sender,  # sender\n"
                + "        True,  # refund\n"
                + "    )\n", source);
    }

    @Test
    void callWithoutTrailingCommaIsJoined() throws ParseException {
        String source = "@external\n"
                + "def foo():\n"
                + "    self.b(0, # amount\n"
                + "     msg.sender, # sender\n"
                + "     True # refund\n"
                + "    )\n";

        _assertFormatted("@external\n"
                + "def foo():\n"
                + "    self.b(0, msg.sender, True)  # amount  # sender  # refund\n", source);
    }

    @Test
    void splitsAtCommasBeforeNestedOperators() throws ParseException {
        String source = "result = foo(alpha_value and beta_value, gamma_value or delta_value,"
                + " epsilon_value and zeta_value)\n";

        _assertFormatted("result = foo(\n"
                + "    alpha_value and beta_value,\n"
                + "    gamma_value or delta_value,\n"
                + "    epsilon_value and zeta_value,\n"
                + ")\n", source);
    }

    @Test
    void separatesDeclarationsWithBlankLines() throws ParseException {
        String source = "# @version ^0.3.7\n"
                + "x: uint256\n"
                + "@external\n"
                + "def foo():\n"
                + "    return 1\n"
                + "@external\n"
                + "def bar():\n"
                + "    pass\n";

        _assertFormatted("# @version ^0.3.7\n"
                + "\n"
                + "x: uint256\n"
                + "\n"
                + "\n"
                + "@external\n"
                + "def foo():\n"
                + "    return 1\n"
                + "\n"
                + "\n"
                + "@external\n"
                + "def bar():\n"
                + "    pass\n", source);
    }

    @Test
    void longSignatureKeepsParametersTogetherWhenTheyFit() throws ParseException {
        String source = "@external\n"
                + "def transfer_from(sender_address: address, receiver_address: address, token_amount: uint256) -> bool:\n"
                + "    return True\n";

        _assertFormatted("@external\n"
                + "def transfer_from(\n"
                + "    sender_address: address, receiver_address: address, token_amount: uint256\n"
                + ") -> bool:\n"
                + "    return True\n", source);
    }

    @Test
    void singleParameterSignatureGetsTrailingComma() throws ParseException {
        String source = "@external\n"
                + "def set_owner_address_for_the_contract(the_new_owner_address_value: address) -> address:\n"
                + "    return msg.sender\n";

        _assertFormatted("@external\n"
                + "def set_owner_address_for_the_contract(\n"
                + "    the_new_owner_address_value: address,\n"
                + ") -> address:\n"
                + "    return msg.sender\n", source);
    }

    @Test
    void wrapsLongRightHandSideInParentheses() throws ParseException {
        String source = "total_supply_value = first_balance_amount + second_balance_amount + third_balance_amount_x\n";

        _assertFormatted("total_supply_value = (\n"
                + "    first_balance_amount + second_balance_amount + third_balance_amount_x\n"
                + ")\n", source);
    }

    @Test
    void normalizesOperatorsQuotesAndComments() throws ParseException {
        String source = "x: uint256 #counter\n"
                + "@external\n"
                + "def foo() -> String[5]:\n"
                + "    self.x=1+2\n"
                + "    return 'hello'\n";

        _assertFormatted("x: uint256  # counter\n"
                + "\n"
                + "\n"
                + "@external\n"
                + "def foo() -> String[5]:\n"
                + "    self.x = 1 + 2\n"
                + "    return \"hello\"\n", source);
    }

    @Test
    void powerOperatorIsHugged() throws ParseException {
        String source = "DECIMALS: constant(uint256) = 10 ** 18\n"
                + "HALF: constant(int256) = 2 ** -1\n"
                + "x **= 2\n";

        _assertFormatted("DECIMALS: constant(uint256) = 10**18\n"
                + "HALF: constant(int256) = 2**-1\n"
                + "x **= 2\n", source);
    }

    @Test
    void dropsRedundantParenthesesAroundCondition() throws ParseException {
        String source = "@external\n"
                + "def foo(x: uint256):\n"
                + "    if (x > 1):\n"
                + "        pass\n";

        _assertFormatted("@external\n"
                + "def foo(x: uint256):\n"
                + "    if x > 1:\n"
                + "        pass\n", source);
    }

    @Test
    void formattedCodeIsStable() throws ParseException {
        String formatted = "result = foo(\n"
                + "    alpha_value and beta_value,\n"
                + "    gamma_value or delta_value,\n"
                + "    epsilon_value and zeta_value,\n"
                + ")\n";

        _assertFormatted(formatted, formatted);
    }

    @Test
    void reportsLinesThatCannotBeSplit() throws ParseException {
        String name = "a".repeat(90);
        String source = "@external\n"
                + "def foo() -> uint256:\n"
                + "    return " + name + "\n";

        TreeFormatter.Result result = new TreeFormatter(80).format(Tokenizer.tokenize(source));

        assertEquals(source, result.getText());
        List<TreeFormatter.Overflow> overflows = result.getOverflows();
        assertEquals(1, overflows.size());
        assertEquals(3, overflows.get(0).getOutputLine());
        assertEquals(3, overflows.get(0).getSourceLine());
        assertEquals(101, overflows.get(0).getWidth());
    }

    @Test
    void outputLinesFitTheConfiguredLength() throws ParseException {
        String source = "@external\n"
                + "def foo():\n"
                + "    self.b(alpha_value, beta_value, gamma_value, delta_value)\n";

        String formatted = new TreeFormatter(40).format(Tokenizer.tokenize(source)).getText();

        for (String line : formatted.split("\n")) {
            assertTrue(line.length() <= 40, "too long: " + line);
        }
    }

    @Test
    void compoundStatementWithoutColonIsUnsupported() throws ParseException {
        TreeFormatter formatter = new TreeFormatter(80);

        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> formatter.format(Tokenizer.tokenize("if x\n")));
        assertEquals(1, e.getLine());
    }

    private static void _assertFormatted(String expected, String source) throws ParseException {
        String formatted = new TreeFormatter(80).format(Tokenizer.tokenize(source)).getText();
        assertEquals(expected, formatted);
        assertEquals(expected, new TreeFormatter(80).format(Tokenizer.tokenize(formatted)).getText());
    }
}
