package com.formshift.core.generator;

import com.formshift.core.model.ControlNode;
import com.formshift.core.model.DataBinding;
import com.formshift.core.model.LayoutAnalysisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ViewModelEmitterTest {

    private final ViewModelEmitter emitter = new ViewModelEmitter();
    private final NamingContext naming = new NamingContext("Shop", "OrderForm", "OrderForm", "OrderFormViewModel");

    private ControlNode form;

    @BeforeEach
    void setUp() {
        form = new ControlNode("Form", "OrderForm");
        var name = new ControlNode("TextBox", "nameBox");
        name.addDataBinding(new DataBinding("Text", "orderSource", "CustomerName", null, true));
        var urgent = new ControlNode("CheckBox", "urgentBox");
        urgent.addDataBinding(new DataBinding("Checked", "orderSource", "IsUrgent", null, false));
        var quantity = new ControlNode("NumericUpDown", "quantity");
        quantity.addDataBinding(new DataBinding("Value", "orderSource", "Quantity", null, false));
        var echo = new ControlNode("Label", "echo");
        echo.addDataBinding(new DataBinding("Text", "orderSource", "CustomerName", null, false));
        var save = new ControlNode("Button", "saveButton");
        save.addEvent("Click", "saveButton_Click");
        save.addEvent("MouseEnter", "saveButton_MouseEnter");
        var saveAgain = new ControlNode("Button", "saveMenu");
        saveAgain.addEvent("Click", "saveButton_Click");
        form.addChild(name).addChild(urgent).addChild(quantity).addChild(echo).addChild(save).addChild(saveAgain);
    }

    @Test
    @DisplayName("emits a regenerated part and a user-owned part")
    void artifacts() {
        var artifacts = emitter.emit(form, LayoutAnalysisResult.freePositioned("test"), naming);
        assertEquals(2, artifacts.size());
        assertEquals("ViewModels/OrderFormViewModel.g.cs", artifacts.get(0).relativePath());
        assertTrue(artifacts.get(0).overwrite());
        assertEquals("ViewModels/OrderFormViewModel.cs", artifacts.get(1).relativePath());
        assertFalse(artifacts.get(1).overwrite());
        assertTrue(artifacts.get(1).content().contains("public partial class OrderFormViewModel"));
    }

    @Test
    @DisplayName("one observable property per distinct data member, typed by bound property")
    void boundProperties() {
        var properties = ViewModelEmitter.boundProperties(form);
        assertEquals(3, properties.size());
        assertEquals(new ViewModelEmitter.BoundProperty("CustomerName", "string", "string.Empty"), properties.get(0));
        assertEquals(new ViewModelEmitter.BoundProperty("IsUrgent", "bool", "false"), properties.get(1));
        assertEquals(new ViewModelEmitter.BoundProperty("Quantity", "int", "0"), properties.get(2));
    }

    @Test
    @DisplayName("one relay command per distinct command handler")
    void commands() {
        var commands = ViewModelEmitter.commands(form);
        assertEquals(1, commands.size());
        assertEquals("SaveButtonClick", commands.get(0).methodName());
        assertEquals("saveButton.Click", commands.get(0).origin());
    }

    @Test
    @DisplayName("generated part declares the CommunityToolkit members")
    void generatedSource() {
        String code = emitter.generated(form, naming);
        assertTrue(code.contains("namespace Shop.ViewModels;"));
        assertTrue(code.contains("public partial class OrderFormViewModel : ObservableObject"));
        assertTrue(code.contains("    [ObservableProperty]\n    private string customerName = string.Empty;"));
        assertTrue(code.contains("    private bool isUrgent = false;"));
        assertTrue(code.contains("    [RelayCommand]\n    private void SaveButtonClick()"));
        assertFalse(code.contains("MouseEnter"));
    }
}
