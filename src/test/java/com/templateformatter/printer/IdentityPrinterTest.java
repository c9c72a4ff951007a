package com.templateformatter.printer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import com.templateformatter.ast.HtmlElementNode;
import com.templateformatter.ast.ParseResult;
import com.templateformatter.parser.TemplateParser;

class IdentityPrinterTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   \n\t  \n",
            "<div class=\"a  b\"   id='x'>\n  text  </div>",
            "<DIV>hello</DIV>",
            "<br/><img src=logo.png ><input disabled>",
            "<br/ ><img src=\"a\"/\n><input / value=\"x\">",
            "<!DOCTYPE html>\r\n<html>\r\n<body></body>\r\n</html>\r\n",
            "<!-- a <%= b %> c --><![CDATA[ raw < ]]>",
            "<pre>\r\n  keep\r\n    this\r\n</pre>",
            "<script>\r\n  if (a < b) {}\r\n</script>",
            "<% if user %>\n  <%= user.name -%>\n<% elsif guest %>\n<% else %>\n<% end %>",
            "<% case x %>\n<% when 1 %>one<% else %>other<% end %>",
            "<ul>\n<% items.each do |item| %>\n  <li><%== item %></li>\n<% end %>\n</ul>\n",
            "<p data-<%= key %>=\"<%= value %>\" <%= attrs %>></p>",
    })
    void testRoundTripReproducesSource(String source) {
        ParseResult result = TemplateParser.parse(source, true);

        assertThat(IdentityPrinter.printNode(result.getValue())).isEqualTo(source);
    }

    @Test
    void testRoundTripKeepsMalformedInput() {
        String source = "<div><span>A</div><% if x %>";
        ParseResult result = TemplateParser.parse(source, true);

        assertThat(result.hasErrors()).isTrue();
        assertThat(IdentityPrinter.printNode(result.getValue())).isEqualTo(source);
    }

    @Test
    void testPrintRejectsTreeWithErrorsUnlessIgnored() {
        ParseResult result = TemplateParser.parse("<div>", true);
        IdentityPrinter printer = new IdentityPrinter();

        assertThatThrownBy(() -> printer.print(result))
                .isInstanceOf(PrintException.class)
                .hasMessageContaining("Missing close tag for <div>");
        assertThat(printer.print(result.getValue(), true)).isEqualTo("<div>");
    }

    @Test
    void testPrintsSubtree() {
        ParseResult result = TemplateParser.parse("<p>one</p><p class='two'>two</p>", true);
        HtmlElementNode second = (HtmlElementNode) result.getValue().getChildren().get(1);

        assertThat(IdentityPrinter.printNode(second)).isEqualTo("<p class='two'>two</p>");
        assertThat(IdentityPrinter.printNodes(second.getBody())).isEqualTo("two");
    }
}
