package com.librenovel.ast;

/**
 * Visitor interface for traversing script statement nodes.
 * Every node kind has its own method, so adding a kind forces every
 * implementation to decide how to handle it.
 *
 * @param <T> The return type of the visit methods
 */
public interface NodeVisitor<T> {

    // Dialogue
    T visitSay(Node.Say node);
    T visitMenu(Node.Menu node);

    // Flow control
    T visitLabel(Node.Label node);
    T visitJump(Node.Jump node);
    T visitCall(Node.Call node);
    T visitReturn(Node.Return node);
    T visitPass(Node.Pass node);
    T visitWhile(Node.While node);
    T visitIf(Node.If node);

    // Displayables
    T visitImage(Node.Image node);
    T visitTransform(Node.Transform node);
    T visitShow(Node.Show node);
    T visitShowLayer(Node.ShowLayer node);
    T visitScene(Node.Scene node);
    T visitHide(Node.Hide node);
    T visitWith(Node.With node);

    // Code and declarations
    T visitPython(Node.Python node);
    T visitEarlyPython(Node.EarlyPython node);
    T visitInit(Node.Init node);
    T visitDefine(Node.Define node);
    T visitUserStatement(Node.UserStatement node);
    T visitStyle(Node.Style node);

    // Translations
    T visitTranslate(Node.Translate node);
    T visitEndTranslate(Node.EndTranslate node);
    T visitTranslateString(Node.TranslateString node);
    T visitTranslateBlock(Node.TranslateBlock node);

    // Screens
    T visitScreen(Node.Screen node);

    T visitUnknown(Node.Unknown node);
}
